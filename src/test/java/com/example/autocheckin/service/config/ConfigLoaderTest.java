package com.example.autocheckin.service.config;

import com.example.autocheckin.config.CheckinProperties;
import com.example.autocheckin.exception.ConfigException;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ConfigLoader Tests")
class ConfigLoaderTest {

    private static final String BASE_CONFIG = """
            app_id: 1001
            app_hash: abc
            log:
              dir: ./log
              level: info
            accounts:
              - name: main
                phone: "+100"
                tasks:
                  - name: checkin
                    target: "@bot"
                    method: message
                    payload: /checkin
                    schedule: "0 8 * * *"
                  - name: legacy
                    target: "@old"
                    method: button
                    payload: Go
                    enabled: false
            """;

    @TempDir
    Path tempDir;

    private ConfigLoader loader;
    private Path configFile;

    @BeforeEach
    void setUp() throws IOException {
        loader = new ConfigLoader(new CheckinProperties(), new ConfigResolver());
        configFile = tempDir.resolve("config.yaml");
        Files.writeString(configFile, BASE_CONFIG);
    }

    @Nested
    @DisplayName("File loading")
    class FileLoadingTests {

        @Test
        @DisplayName("Should read snake_case YAML into the configuration model")
        void shouldReadYaml() {
            var config = loader.load(configFile, Map.of());

            assertThat(config.getAppId()).isEqualTo(1001);
            assertThat(config.getAccounts()).hasSize(1);
            var account = config.getAccounts().get(0);
            assertThat(account.getLabel()).isEqualTo("main(+100)");
            assertThat(account.getTasks()).hasSize(2);
            assertThat(account.getTasks().get(0).isEffectivelyEnabled()).isTrue();
            assertThat(account.getTasks().get(1).isEffectivelyEnabled()).isFalse();
        }

        @Test
        @DisplayName("Should fail with ConfigException when the file is missing")
        void shouldFailWhenMissing() {
            assertThatThrownBy(() -> loader.load(tempDir.resolve("absent.yaml"), Map.of()))
                    .isInstanceOf(ConfigException.class)
                    .hasMessageContaining("not found");
        }

        @Test
        @DisplayName("Should fail with ConfigException when the file is not valid YAML")
        void shouldFailWhenMalformed() throws IOException {
            Files.writeString(configFile, "accounts: [unclosed");

            assertThatThrownBy(() -> loader.load(configFile, Map.of()))
                    .isInstanceOf(ConfigException.class);
        }
    }

    @Nested
    @DisplayName("Environment overlay file")
    class OverlayFileTests {

        @Test
        @DisplayName("Should merge config.<env>.yaml when the environment marker is set")
        void shouldMergeOverlayFile() throws IOException {
            Files.writeString(tempDir.resolve("config.prod.yaml"), """
                    log:
                      level: warn
                    accounts:
                      - name: main
                        tasks:
                          - payload: /daily
                    """);

            var config = loader.load(configFile, Map.of("APP_ENV", "prod"));

            assertThat(config.getLog().getLevel()).isEqualTo("warn");
            assertThat(config.getLog().getDir()).isEqualTo("./log");
            var task = config.getAccounts().get(0).getTasks().get(0);
            assertThat(task.getPayload()).isEqualTo("/daily");
            assertThat(task.getSchedule()).isEqualTo("0 8 * * *");
        }

        @Test
        @DisplayName("Should ignore the marker when the overlay file does not exist")
        void shouldIgnoreMissingOverlay() {
            var config = loader.load(configFile, Map.of("APP_ENV", "staging"));

            assertThat(config.getLog().getLevel()).isEqualTo("info");
        }

        @Test
        @DisplayName("Should derive the overlay path next to the main file")
        void shouldDeriveOverlayPath() {
            assertThat(ConfigLoader.overlayPath(Path.of("conf", "config.yaml"), "prod"))
                    .isEqualTo(Path.of("conf", "config.prod.yaml"));
        }
    }

    @Nested
    @DisplayName("Environment variables")
    class EnvironmentVariableTests {

        @Test
        @DisplayName("Should override scalar values from prefixed variables")
        void shouldOverrideScalars() {
            var config = loader.load(configFile, Map.of(
                    "TG_LOG_LEVEL", "debug",
                    "TG_APP_ID", "2002",
                    "TG_ACCOUNTS_0_PHONE", "+200",
                    "TG_ACCOUNTS_0_TASKS_1_ENABLED", "true"
            ));

            assertThat(config.getLog().getLevel()).isEqualTo("debug");
            assertThat(config.getAppId()).isEqualTo(2002);
            assertThat(config.getAccounts().get(0).getPhone()).isEqualTo("+200");
            assertThat(config.getAccounts().get(0).getTasks().get(1).isEffectivelyEnabled()).isTrue();
        }

        @Test
        @DisplayName("Should ignore variables without the prefix")
        void shouldIgnoreUnprefixedVariables() {
            var config = loader.load(configFile, Map.of("LOG_LEVEL", "debug"));

            assertThat(config.getLog().getLevel()).isEqualTo("info");
        }

        @Test
        @DisplayName("Should build variable names from dotted paths")
        void shouldBuildVariableNames() {
            var overlay = new EnvironmentOverlay(new YAMLMapper(), "tg");

            assertThat(overlay.variableName("log.level")).isEqualTo("TG_LOG_LEVEL");
            assertThat(overlay.variableName("accounts.0.phone")).isEqualTo("TG_ACCOUNTS_0_PHONE");
        }

        @Test
        @DisplayName("Should reject values that do not fit the field type")
        void shouldRejectInvalidValues() {
            assertThatThrownBy(() -> loader.load(configFile, Map.of("TG_APP_ID", "not-a-number")))
                    .isInstanceOf(ConfigException.class);
        }
    }
}
