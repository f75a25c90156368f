package com.courtster.pairing.runner;

import com.courtster.pairing.engine.RoundOutcome;
import com.courtster.pairing.model.Player;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes tournament metadata, round files and standings to disk.
 * Every file is written to a temp file first and moved into place, so readers never
 * see a partial write.
 */
public class RoundFileWriter {

    static final String ROUND_FILE_GLOB = "round-[0-9][0-9].json";

    private final Path outputDir;
    private final ObjectMapper objectMapper;

    public RoundFileWriter(Path outputDir) {
        this.outputDir = outputDir;
        this.objectMapper = ObjectMapperFactory.create();
    }

    /**
     * Writes the tournament.json metadata file.
     */
    public void writeTournamentMetadata(SimulationConfig config) throws IOException {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("rounds", config.rounds());
        settings.put("courts", config.courts());
        settings.put("format", config.format());
        settings.put("genderPreference", config.genderPreference());
        settings.put("scoring", config.scoring().toString());
        settings.put("seed", config.seed());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("name", config.name());
        metadata.put("config", settings);
        metadata.put("players", config.players());
        write("tournament.json", metadata);
    }

    /**
     * Writes a round-NN.json file with the scored round, the roster after it and any
     * degradations.
     */
    public void writeRound(RoundOutcome outcome) throws IOException {
        write(roundFileName(outcome.round().number()), outcome);
    }

    /**
     * Writes standings.json, players in standings order.
     */
    public void writeStandings(List<Player> standings) throws IOException {
        write("standings.json", standings);
    }

    /**
     * Removes round files left by an earlier run into the same directory.
     *
     * @return number of files deleted
     */
    public int clearRounds() throws IOException {
        if (!Files.isDirectory(outputDir)) {
            return 0;
        }
        int deleted = 0;
        try (DirectoryStream<Path> stale = Files.newDirectoryStream(outputDir, ROUND_FILE_GLOB)) {
            for (Path file : stale) {
                Files.delete(file);
                deleted++;
            }
        }
        return deleted;
    }

    public boolean roundExists(int roundNumber) {
        return Files.exists(outputDir.resolve(roundFileName(roundNumber)));
    }

    static String roundFileName(int roundNumber) {
        return String.format("round-%02d.json", roundNumber);
    }

    private void write(String filename, Object value) throws IOException {
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(filename);
        Path temp = outputDir.resolve(filename + ".tmp");
        objectMapper.writeValue(temp.toFile(), value);
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }
}
