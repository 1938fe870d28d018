package de.bsommerfeld.xivpatch.updater.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class GameVersionTest {

    @Test
    void parse_shouldStripWhitespace() {
        assertEquals("2025.05.29.0000.0000", GameVersion.parse(" 2025.05.29.0000.0000\r\n").value());
    }

    @Test
    void constructor_shouldRejectMalformedVersions() {
        assertThrows(VersionFormatException.class, () -> new GameVersion("2025.5.29.0000.0000"));
        assertThrows(VersionFormatException.class, () -> new GameVersion("2025.05.29.0000"));
        assertThrows(VersionFormatException.class, () -> new GameVersion("2025.05.29.0000.000a"));
        assertThrows(VersionFormatException.class, () -> new GameVersion(""));
        assertThrows(VersionFormatException.class, () -> GameVersion.parse(null));
    }

    @Test
    void isFullInstallPackage_shouldMatchSentinelPrefix() {
        assertTrue(GameVersion.parse("2012.01.01.0000.0001").isFullInstallPackage());
        assertFalse(GameVersion.parse("2012.01.02.0000.0000").isFullInstallPackage());
    }

    @Test
    void compareTo_shouldOrderBuildNumbersWithinADay() {
        GameVersion first = GameVersion.parse("2025.05.29.0000.0000");
        GameVersion second = GameVersion.parse("2025.05.29.0001.0000");
        GameVersion third = GameVersion.parse("2025.05.29.0001.0002");

        assertTrue(second.isNewerThan(first));
        assertTrue(third.isNewerThan(second));
        assertFalse(first.isNewerThan(first));
    }

    @Test
    void compareTo_shouldAgreeWithChronologicalOrder() {
        Random random = new Random(20250529);
        LocalDate epoch = LocalDate.of(2010, 1, 1);
        for (int i = 0; i < 500; i++) {
            LocalDate a = epoch.plusDays(random.nextInt(8000));
            LocalDate b = epoch.plusDays(random.nextInt(8000));
            int buildA = random.nextInt(10000);
            int buildB = random.nextInt(10000);

            int expected = a.equals(b) ? Integer.compare(buildA, buildB) : a.compareTo(b);
            int actual = version(a, buildA).compareTo(version(b, buildB));
            assertEquals(Integer.signum(expected), Integer.signum(actual), a + "/" + buildA + " vs " + b + "/" + buildB);
        }
    }

    private static GameVersion version(LocalDate date, int build) {
        return new GameVersion(String.format("%04d.%02d.%02d.%04d.0000",
                date.getYear(), date.getMonthValue(), date.getDayOfMonth(), build));
    }
}
