package com.shadowdeploy.orchestrator.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class BreakingChangeDetectorTest {

    final BreakingChangeDetector detector = new BreakingChangeDetector();

    @ParameterizedTest
    @ValueSource(strings = {
            "DROP TABLE analytics.orders;",
            "drop table staging.customers",
            "ALTER TABLE orders DROP COLUMN discount",
            "ALTER TABLE orders ALTER COLUMN id SET NOT NULL",
            "alter table t alter column c set   not null"
    })
    void hasBreakingChanges_destructiveDiff_isDetected(String diff) {
        assertThat(detector.hasBreakingChanges(diff)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "CREATE TABLE analytics.orders (id INT)",
            "INSERT INTO orders VALUES (1)",
            "ALTER TABLE orders ADD COLUMN note TEXT",
            ""
    })
    void hasBreakingChanges_additiveDiff_isNotDetected(String diff) {
        assertThat(detector.hasBreakingChanges(diff)).isFalse();
    }

    @Test
    void hasBreakingChanges_null_isFalse() {
        assertThat(detector.hasBreakingChanges(null)).isFalse();
    }

    @Test
    void detectDataLoss_flagsTruncateAndDeleteWithoutBlocking() {
        String diff = "TRUNCATE TABLE staging.events; DELETE FROM orders WHERE id < 10";

        assertThat(detector.detectDataLoss(diff)).isTrue();
        assertThat(detector.hasBreakingChanges(diff)).isFalse();
    }

    @Test
    void detectDataLoss_createOnly_isFalse() {
        assertThat(detector.detectDataLoss("CREATE VIEW v AS SELECT 1")).isFalse();
    }
}
