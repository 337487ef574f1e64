package com.pgstash.postgres.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PostgresVersion")
class PostgresVersionTest {

    @Test
    @DisplayName("should parse tool output and ignore patch level")
    void shouldParseToolOutput() {
        assertThat(PostgresVersion.parse("pg_receivexlog (PostgreSQL) 9.4.4")).isEqualTo(new PostgresVersion(9, 4));
        assertThat(PostgresVersion.parse("pg_receivewal (PostgreSQL) 15.4")).isEqualTo(new PostgresVersion(15, 0));
        assertThat(PostgresVersion.parse("9.2")).isEqualTo(new PostgresVersion(9, 2));
    }

    @Test
    @DisplayName("should return null when there is no version")
    void shouldReturnNullWithoutVersion() {
        assertThat(PostgresVersion.parse("command not found")).isNull();
        assertThat(PostgresVersion.parse(null)).isNull();
    }

    @Test
    @DisplayName("should convert server_version_num")
    void shouldConvertVersionNum() {
        assertThat(PostgresVersion.fromVersionNum(90605)).isEqualTo(new PostgresVersion(9, 6));
        assertThat(PostgresVersion.fromVersionNum(100012)).isEqualTo(new PostgresVersion(10, 0));
        assertThat(PostgresVersion.fromVersionNum(150004).toString()).isEqualTo("15");
        assertThat(PostgresVersion.fromVersionNum(90324).toString()).isEqualTo("9.3");
    }

    @Test
    @DisplayName("should order by major then minor")
    void shouldOrder() {
        assertThat(new PostgresVersion(9, 5)).isGreaterThan(new PostgresVersion(9, 3));
        assertThat(new PostgresVersion(10, 0)).isGreaterThan(new PostgresVersion(9, 6));
        assertThat(new PostgresVersion(9, 2).isBefore(9, 3)).isTrue();
        assertThat(new PostgresVersion(12, 3)).isEqualByComparingTo(new PostgresVersion(12, 9));
    }
}
