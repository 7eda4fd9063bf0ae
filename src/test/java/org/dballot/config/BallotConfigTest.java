package org.dballot.config;

import org.dballot.identity.Identity;
import org.dballot.proposal.LabelPolicy;
import org.dballot.store.InMemoryBallotStore;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class BallotConfigTest {

    @Test
    public void testDefaults() {
        BallotConfig config = BallotConfig.defaults();

        assertEquals(3, config.getProposals().size());
        assertNull(config.getAdministrator());
        assertEquals(LabelPolicy.TRUNCATE, config.getLabelPolicy());
        assertEquals(BallotConfig.StorageType.MEMORY, config.getStorage());
        assertEquals(8080, config.getPort());
        assertInstanceOf(InMemoryBallotStore.class, config.openStore());
    }

    @Test
    public void testFileOverridesDefaults() throws URISyntaxException {
        Path path = Path.of(getClass().getResource("/ballot-test.json").toURI());
        BallotConfig config = BallotConfig.load(path);

        assertEquals(List.of("Library", "Pool"), config.getProposals());
        assertEquals(Identity.of("chair"), config.getAdministrator());
        assertEquals(LabelPolicy.REJECT, config.getLabelPolicy());
        assertEquals(9090, config.getPort());
        // untouched keys keep their defaults
        assertEquals("127.0.0.1", config.getHost());
        assertEquals(300, config.getSignatureWindowSeconds());
    }

    @Test
    public void testLenientParsing() {
        BallotConfig config = BallotConfig.fromReader(new StringReader("{ // comment\n storage: 'sqlite', dbFile: 'x.db' }"));

        assertEquals(BallotConfig.StorageType.SQLITE, config.getStorage());
        assertEquals("x.db", config.getDbFile());
    }

    @Test
    public void testInvalidValuesRejected() {
        assertThrows(IllegalArgumentException.class, () -> BallotConfig.fromReader(new StringReader("[1, 2]")));
        assertThrows(IllegalArgumentException.class, () -> BallotConfig.fromReader(new StringReader("{\"port\": 70000}")));
        assertThrows(IllegalArgumentException.class, () -> BallotConfig.fromReader(new StringReader("{\"storage\": \"tape\"}")));
        assertThrows(IllegalArgumentException.class, () -> BallotConfig.fromReader(new StringReader("{\"proposals\": \"one\"}")));
    }
}
