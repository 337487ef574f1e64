package com.pgstash.quarkusroot;

import com.pgstash.configuration.exception.ConfigurationException;
import com.pgstash.quarkusroot.validator.ConfigurationValidator;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuarkusStartupHandlerTest {

    @Test
    void validConfigurationPasses() {
        QuarkusStartupHandler handler = new QuarkusStartupHandler();
        handler.configurationValidators = List.of(() -> true, () -> true);

        assertThatCode(handler::validateConfiguration).doesNotThrowAnyException();
    }

    @Test
    void everyValidatorRunsBeforeFailing() {
        List<String> called = new ArrayList<>();
        ConfigurationValidator failing = () -> {
            called.add("general");
            return false;
        };
        ConfigurationValidator passing = () -> {
            called.add("servers");
            return true;
        };
        QuarkusStartupHandler handler = new QuarkusStartupHandler();
        handler.configurationValidators = List.of(failing, passing);

        assertThatThrownBy(handler::validateConfiguration)
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("Provided configuration is invalid");
        assertThat(called).containsExactly("general", "servers");
    }
}
