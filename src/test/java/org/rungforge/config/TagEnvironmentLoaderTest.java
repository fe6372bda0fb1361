package org.rungforge.config;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.rungforge.junit.extensions.logging.ExpectLog;
import org.rungforge.junit.extensions.logging.LogLevel;
import org.rungforge.junit.extensions.logging.LogWatchExtension;
import org.rungforge.logic.tags.TagEnvironment;
import org.rungforge.logic.tags.TagScope;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class TagEnvironmentLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_readsProgramTagsAndAddOnInstructions() throws IOException {
        // Arrange
        Path file = tempDir.resolve("tags.conf");
        Files.writeString(file, """
                program = "MainProgram"
                add-on-instructions = ["VALVE_CTRL"]
                controller-tags = [
                  { name = "Conveyor" }
                  { name = "StartPB", alias-for = "Local:1:I.Data.0" }
                ]
                program-tags = [
                  { name = "Motor", alias-for = "Conveyor.Motor" }
                ]
                """);

        // Act
        TagEnvironment environment = TagEnvironmentLoader.load(file.toFile());

        // Assert
        assertThat(environment.getContainerName()).contains("MainProgram");
        assertThat(environment.isAddOnInstruction("VALVE_CTRL")).isTrue();
        assertThat(environment.getControllerTags().lookup("StartPB"))
                .hasValueSatisfying(tag -> assertThat(tag.aliasFor()).isEqualTo("Local:1:I.Data.0"));
        assertThat(environment.getControllerTags().lookup("Conveyor"))
                .hasValueSatisfying(tag -> assertThat(tag.isAlias()).isFalse());
        assertThat(environment.getLocalTags().lookup("Motor"))
                .hasValueSatisfying(tag -> assertThat(tag.scope()).isEqualTo(TagScope.PROGRAM));
    }

    @Test
    void fromConfig_allKeysAreOptional() {
        TagEnvironment environment = TagEnvironmentLoader.fromConfig(ConfigFactory.empty());

        assertThat(environment.getContainerName()).isEmpty();
        assertThat(environment.getAddOnInstructionNames()).isEmpty();
        assertThat(environment.getLocalTags().lookup("Anything")).isEmpty();
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Duplicate CONTROLLER tag 'Run'.*")
    void fromConfig_keepsLastDuplicate() {
        TagEnvironment environment = TagEnvironmentLoader.fromConfig(ConfigFactory.parseString("""
                controller-tags = [
                  { name = "Run" }
                  { name = "Run", alias-for = "Start" }
                ]
                """));

        assertThat(environment.getControllerTags().lookup("Run"))
                .hasValueSatisfying(tag -> assertThat(tag.aliasFor()).isEqualTo("Start"));
    }

    @Test
    void fromConfig_rejectsTagWithoutName() {
        assertThatThrownBy(() -> TagEnvironmentLoader.fromConfig(ConfigFactory.parseString(
                "program-tags = [ { alias-for = \"X\" } ]")))
                .isInstanceOf(ConfigException.Missing.class);
    }

    @Test
    void load_rejectsMissingFile() {
        assertThatThrownBy(() -> TagEnvironmentLoader.load(tempDir.resolve("none.conf").toFile()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
