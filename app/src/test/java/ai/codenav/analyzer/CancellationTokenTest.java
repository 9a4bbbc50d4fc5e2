package ai.codenav.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.CancellationException;
import org.junit.jupiter.api.Test;

public class CancellationTokenTest {

    @Test
    public void testCancel() {
        var token = new CancellationToken();
        assertFalse(token.isCancelled());
        token.checkCancelled();

        token.cancel();
        assertTrue(token.isCancelled());
        assertThrows(CancellationException.class, token::checkCancelled);
    }

    @Test
    public void testInterruptCounts() {
        var token = CancellationToken.none();
        Thread.currentThread().interrupt();
        try {
            assertTrue(token.isCancelled());
        } finally {
            Thread.interrupted();
        }
        assertFalse(token.isCancelled());
    }

    @Test
    public void testSharedTokenCannotBeCancelled() {
        assertThrows(UnsupportedOperationException.class, () -> CancellationToken.none().cancel());
    }
}
