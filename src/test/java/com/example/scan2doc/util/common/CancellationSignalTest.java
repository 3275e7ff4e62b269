package com.example.scan2doc.util.common;

import com.example.scan2doc.exception.DocGenException;
import com.example.scan2doc.exception.GenerationCancelledException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CancellationSignalTest {

    @Test
    void checkpointPassesUntilCancelled() throws Exception {
        CancellationSignal signal = new CancellationSignal();
        signal.checkpoint("DOCX");
        assertFalse(signal.isCancelled());

        signal.cancel();

        assertTrue(signal.isCancelled());
        GenerationCancelledException e = assertThrows(GenerationCancelledException.class, () -> signal.checkpoint("PDF"));
        assertEquals(DocGenException.ErrorKind.CANCELLED, e.getKind());
        assertTrue(e.getMessage().contains("PDF"));
    }
}
