package logq.engine.exec;

import static logq.engine.exec.Truth.*;
import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class TruthTest {

    @Test
    void andTable() {
        Truth[][] expected = {
            // TRUE     FALSE  UNKNOWN
            {TRUE, FALSE, UNKNOWN},     // TRUE
            {FALSE, FALSE, FALSE},      // FALSE
            {UNKNOWN, FALSE, UNKNOWN},  // UNKNOWN
        };
        Truth[] vals = Truth.values();
        for (int i = 0; i < vals.length; i++) {
            for (int j = 0; j < vals.length; j++) {
                assertEquals(expected[i][j], vals[i].and(vals[j]), vals[i] + " AND " + vals[j]);
            }
        }
    }

    @Test
    void orTable() {
        Truth[][] expected = {
            {TRUE, TRUE, TRUE},
            {TRUE, FALSE, UNKNOWN},
            {TRUE, UNKNOWN, UNKNOWN},
        };
        Truth[] vals = Truth.values();
        for (int i = 0; i < vals.length; i++) {
            for (int j = 0; j < vals.length; j++) {
                assertEquals(expected[i][j], vals[i].or(vals[j]), vals[i] + " OR " + vals[j]);
            }
        }
    }

    @Test
    void notTable() {
        assertEquals(FALSE, TRUE.not());
        assertEquals(TRUE, FALSE.not());
        assertEquals(UNKNOWN, UNKNOWN.not());
    }
}
