package com.pgstash.quarkusroot.validator;

import com.pgstash.configuration.properties.predefined.PgStashProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ServersConfigurationValidatorTest {

    @Mock
    private PgStashProperties pgStashProperties;

    @Mock
    private PgStashProperties.ServerProperties server;

    @InjectMocks
    private ServersConfigurationValidator validator;

    @BeforeEach
    void setUp() {
        when(pgStashProperties.servers()).thenReturn(Map.of("main", server));
        when(server.conninfo()).thenReturn("host=pg01 user=postgres dbname=postgres");
    }

    @Test
    void validServer() {
        when(server.sshCommand()).thenReturn(Optional.of("ssh -o 'BatchMode yes' postgres@pg01"));
        when(server.slotName()).thenReturn(Optional.of("pgstash_main"));
        when(server.bandwidthLimit()).thenReturn(OptionalInt.of(4000));
        when(server.archiver()).thenReturn(true);

        assertThat(validator.validate()).isTrue();
    }

    @Test
    void malformedConnInfo() {
        when(server.conninfo()).thenReturn("host='pg01");

        assertThat(validator.validate()).isFalse();
    }

    @Test
    void malformedStreamingConnInfo() {
        when(server.streamingConninfo()).thenReturn(Optional.of("host pg01"));

        assertThat(validator.validate()).isFalse();
    }

    @Test
    void unterminatedSshCommand() {
        when(server.sshCommand()).thenReturn(Optional.of("ssh 'postgres@pg01"));

        assertThat(validator.validate()).isFalse();
    }

    @Test
    void negativeBandwidthLimit() {
        when(server.bandwidthLimit()).thenReturn(OptionalInt.of(-1));

        assertThat(validator.validate()).isFalse();
    }

    @Test
    void slotNameWithUpperCase() {
        when(server.slotName()).thenReturn(Optional.of("PgStash"));

        assertThat(validator.validate()).isFalse();
    }

    @Test
    void missingArchiverIsOnlyAWarning() {
        assertThat(validator.validate()).isTrue();
    }
}
