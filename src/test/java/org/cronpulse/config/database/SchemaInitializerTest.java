package org.cronpulse.config.database;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchemaInitializerTest {

    @Test
    void statements_shouldSplitOnTrailingSemicolonAndSkipComments() {
        String script = """
                -- header
                CREATE TABLE a (
                    id INT
                );

                CREATE INDEX IF NOT EXISTS idx_a ON a (id);
                -- trailing
                """;

        List<String> statements = SchemaInitializer.statements(script);

        assertEquals(2, statements.size());
        assertTrue(statements.get(0).startsWith("CREATE TABLE a ("));
        assertTrue(statements.get(0).endsWith(")"));
        assertEquals("CREATE INDEX IF NOT EXISTS idx_a ON a (id)", statements.get(1));
    }

    @Test
    void statements_shouldKeepUnterminatedTail() {
        assertEquals(List.of("SELECT 1"), SchemaInitializer.statements("SELECT 1\n"));
    }
}
