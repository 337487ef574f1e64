package com.pgstash.quarkusroot.command;

import com.pgstash.orchestration.archiver.CheckStrategy;
import com.pgstash.orchestration.service.api.WalArchivingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CheckCommandTest {

    @Mock
    private WalArchivingService walArchivingService;

    private final ByteArrayOutputStream output = new ByteArrayOutputStream();
    private CheckCommand command;

    @BeforeEach
    void setUp() {
        command = new CheckCommand();
        command.walArchivingService = walArchivingService;
        command.out = new PrintStream(output, true, StandardCharsets.UTF_8);
    }

    @Test
    void printsResultsOfServer() {
        when(walArchivingService.check(eq("main"), any(CheckStrategy.class))).thenAnswer(invocation -> {
            CheckStrategy strategy = invocation.getArgument(1);
            strategy.result("main", "PostgreSQL", true, null);
            return true;
        });

        int exitCode = new CommandLine(command).execute("main");

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        assertThat(output.toString(StandardCharsets.UTF_8).lines()).containsExactly("Server main:", "\tPostgreSQL: OK");
    }

    @Test
    void failedCheckExitsWithOne() {
        when(walArchivingService.check(eq("main"), any(CheckStrategy.class))).thenReturn(false);

        assertThat(new CommandLine(command).execute("main")).isEqualTo(ExitCodes.FAILURE);
    }
}
