package com.devcrew.orchestrator.model;

import com.devcrew.orchestrator.persistence.PersistenceException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorKindTest {

    @Test
    void classify_byTypeName() {
        assertThat(ErrorKind.classify("TestFailure")).isEqualTo(ErrorKind.TEST_FAILURE);
        assertThat(ErrorKind.classify("KeyError")).isEqualTo(ErrorKind.MISSING_KEY);
        assertThat(ErrorKind.classify("java.lang.ClassCastException")).isEqualTo(ErrorKind.TYPE_MISMATCH);
        assertThat(ErrorKind.classify("IndexError")).isEqualTo(ErrorKind.INDEX_OUT_OF_RANGE);
    }

    @Test
    void classify_neverLooksAtMessageText() {
        // a type name that merely contains a known word is not a match
        assertThat(ErrorKind.classify("MyKeyErrorWrapper")).isEqualTo(ErrorKind.UNKNOWN);
        assertThat(ErrorKind.classify((String) null)).isEqualTo(ErrorKind.UNKNOWN);
        assertThat(ErrorKind.classify("  ")).isEqualTo(ErrorKind.UNKNOWN);
    }

    @Test
    void classify_throwable_walksSuperclasses() {
        // DataIntegrityViolationException extends DataAccessException
        assertThat(ErrorKind.classify(new DataIntegrityViolationException("dup"))).isEqualTo(ErrorKind.PERSISTENCE);
        assertThat(ErrorKind.classify(new NoSuchElementException())).isEqualTo(ErrorKind.MISSING_KEY);
    }

    @Test
    void classify_throwable_walksCauseChain() {
        RuntimeException wrapped = new RuntimeException("outer",
                new PersistenceException("write failed", null));

        assertThat(ErrorKind.classify(wrapped)).isEqualTo(ErrorKind.PERSISTENCE);
    }

    @Test
    void everyKindCarriesAFixStrategy() {
        for (ErrorKind kind : ErrorKind.values()) {
            assertThat(kind.fixStrategy()).isNotBlank();
            assertThat(kind.severity()).isIn("low", "medium", "high");
        }
    }
}
