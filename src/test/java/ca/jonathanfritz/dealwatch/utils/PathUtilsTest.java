package ca.jonathanfritz.dealwatch.utils;

import org.hamcrest.core.IsEqual;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.nio.file.Path;

import static org.hamcrest.MatcherAssert.assertThat;

class PathUtilsTest {

    private final PathUtils pathUtils = new PathUtils();

    @Test
    void noSeparatorsTest() {
        final Path joined = pathUtils.join("home", "someone");
        assertThat(joined.toString(), IsEqual.equalTo("home" + File.separator + "someone"));
    }

    @Test
    void trailingSeparatorTest() {
        final Path joined = pathUtils.join("home" + File.separator, "someone");
        assertThat(joined.toString(), IsEqual.equalTo("home" + File.separator + "someone"));
    }

    @Test
    void leadingSeparatorTest() {
        final Path joined = pathUtils.join("home", File.separator + "someone");
        assertThat(joined.toString(), IsEqual.equalTo("home" + File.separator + "someone"));
    }

    @Test
    void leadingAndTrailingSeparatorTest() {
        final Path joined = pathUtils.join("home" + File.separator, File.separator + "someone");
        assertThat(joined.toString(), IsEqual.equalTo("home" + File.separator + "someone"));
    }

    @Test
    void dataPathIsInHomeDirectoryTest() {
        final Path dataPath = pathUtils.getDataPath();
        assertThat(dataPath, IsEqual.equalTo(Path.of(System.getProperty("user.home"), ".dealwatch")));
    }

    @Test
    void expandHomeDirectoryTest() {
        final Path expanded = pathUtils.expand("~" + File.separator + "messages.txt");
        assertThat(expanded, IsEqual.equalTo(Path.of(System.getProperty("user.home"), "messages.txt")));
    }

    @Test
    void expandLeavesOtherPathsAloneTest() {
        final Path expanded = pathUtils.expand("messages.txt");
        assertThat(expanded, IsEqual.equalTo(Path.of("messages.txt")));
    }
}
