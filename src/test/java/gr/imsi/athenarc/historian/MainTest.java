package gr.imsi.athenarc.historian;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.beust.jcommander.JCommander;

public class MainTest {

    @TempDir
    Path directory;

    @BeforeEach
    public void setUp() {
        System.setProperty("export.configDir", directory.toString());
    }

    @AfterEach
    public void tearDown() {
        System.clearProperty("export.configDir");
    }

    private static Main parse(String... args) {
        Main main = new Main();
        JCommander.newBuilder().addObject(main).build().parse(args);
        return main;
    }

    @Test
    public void testParsesExportOptions() {
        Main main = parse("-tags", "A", "B", "-start", "2024-01-01", "-end", "2024-01-02",
                "-frequency", "00:10:00", "-native", "-report");
        assertEquals("export", main.mode);
        assertEquals(List.of("A", "B"), main.tags);
        assertEquals("00:10:00", main.frequency);
        assertTrue(main.nativeResampling);
        assertTrue(main.report);
        assertEquals(250, main.perPage);
    }

    @Test
    public void testTagListModes() throws IOException {
        parse("-mode", "create", "-config", "boiler", "-tags", "Temp", "Pressure").run();
        assertEquals(List.of("Temp", "Pressure"), Files.readAllLines(directory.resolve("boiler.txt")));

        parse("-mode", "update", "-config", "boiler", "-tags", "Level").run();
        assertEquals(List.of("Level"), Files.readAllLines(directory.resolve("boiler.txt")));
        assertTrue(Files.exists(directory.resolve("boiler.txt.bak")));

        parse("-mode", "delete", "-config", "boiler").run();
        assertTrue(Files.notExists(directory.resolve("boiler.txt")));
    }

    @Test
    public void testUnknownModeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> parse("-mode", "plot").run());
    }

    @Test
    public void testCreateRequiresTags() {
        assertThrows(IllegalArgumentException.class, () -> parse("-mode", "create", "-config", "empty").run());
    }

    @Test
    public void testShowRequiresConfig() {
        assertThrows(IllegalArgumentException.class, () -> parse("-mode", "show").run());
        assertThrows(IllegalArgumentException.class, () -> parse("-mode", "delete").run());
    }
}
