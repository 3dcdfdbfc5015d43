package me.golemcore.gateway.adapter.outbound.voice;

import com.github.kokorin.jaffree.JaffreeException;
import me.golemcore.gateway.domain.model.AudioExtractionException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JaffreeAudioExtractorTest {

    @Test
    void shouldDetectInterruptWrappedByJaffree() {
        JaffreeException failure = new JaffreeException("Failed to execute, was interrupted",
                new InterruptedException());

        assertTrue(JaffreeAudioExtractor.causedByInterrupt(failure));
        assertTrue(JaffreeAudioExtractor.causedByInterrupt(new AudioExtractionException("wrapped", failure)));
    }

    @Test
    void shouldNotTreatDecodingFailureAsInterrupt() {
        assertFalse(JaffreeAudioExtractor.causedByInterrupt(new JaffreeException("Process execution has ended "
                + "with non-zero status: 1")));
    }
}
