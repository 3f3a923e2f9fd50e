package co.fanki.graphql.execution;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ResultPath}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ResultPathTest {

    @Test
    void whenExtending_givenKeysAndIndexes_shouldKeepSegmentOrder() {
        final ResultPath path = ResultPath.root().key("users").index(1)
                .key("name");

        assertEquals(List.of("users", 1, "name"), path.toList());
        assertEquals("/users/1/name", path.toString());
        assertFalse(path.isRoot());
    }

    @Test
    void whenReadingRoot_givenNoSegments_shouldBeEmpty() {
        assertTrue(ResultPath.root().isRoot());
        assertEquals(List.of(), ResultPath.root().toList());
        assertEquals("/", ResultPath.root().toString());
    }

    @Test
    void whenExtending_givenNegativeIndex_shouldFail() {
        assertThrows(IllegalArgumentException.class,
                () -> ResultPath.root().index(-1));
    }
}
