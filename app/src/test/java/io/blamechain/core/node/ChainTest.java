package io.blamechain.core.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.blamechain.core.consensus.ChainIntegrityException;
import io.blamechain.core.consensus.ChainVerification;
import io.blamechain.core.consensus.MiningTimeoutException;
import io.blamechain.core.consensus.ProofOfWork;
import io.blamechain.core.consensus.Violation;
import io.blamechain.core.protocol.Block;
import io.blamechain.core.storage.InMemoryChainStore;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class ChainTest {

    private static List<JsonNode> entries(String... values) {
        List<JsonNode> out = new ArrayList<>();
        for (String v : values) out.add(TextNode.valueOf(v));
        return out;
    }

    @Test
    void genesisIsMinedAndLinkedToSentinel() {
        Chain chain = new Chain(new InMemoryChainStore(), new ProofOfWork(2));

        Block genesis = chain.head();
        assertEquals(1, chain.size());
        assertEquals(0, genesis.index());
        assertEquals(Block.GENESIS_PREVIOUS_HASH, genesis.previousHash());
        assertTrue(genesis.payload().isEmpty());
        assertTrue(genesis.hash().startsWith("00"));
        assertEquals(genesis.hash(), genesis.recomputeHash());
    }

    @Test
    void appendSingleEntryAtDifficultyOne() {
        Chain chain = new Chain(new InMemoryChainStore(), new ProofOfWork(1));

        Block block = chain.append(entries("hello"));

        assertEquals(1, block.index());
        assertEquals(List.of(TextNode.valueOf("hello")), block.payload());
        assertTrue(block.hash().startsWith("0"));
        assertEquals(chain.block(0).orElseThrow().hash(), block.previousHash());
        assertTrue(chain.verify().isValid());
        assertEquals(block, chain.head());
    }

    @Test
    void fourAppendsGiveFiveLinkedBlocks() {
        Chain chain = new Chain(new InMemoryChainStore(), new ProofOfWork(1));
        for (int i = 0; i < 4; i++) {
            chain.append(entries("e" + i));
        }

        List<Block> blocks = chain.blocks();
        assertEquals(5, blocks.size());
        for (int i = 1; i < blocks.size(); i++) {
            assertEquals(i, blocks.get(i).index());
            assertEquals(blocks.get(i - 1).hash(), blocks.get(i).previousHash());
            assertTrue(blocks.get(i).timestamp() >= blocks.get(i - 1).timestamp());
        }
        assertTrue(chain.verify().isValid());
    }

    @Test
    void tamperedBlockIsReportedByIndex() {
        TamperableChainStore store = new TamperableChainStore();
        Chain chain = new Chain(store, new ProofOfWork(1));
        for (int i = 0; i < 4; i++) {
            chain.append(entries("e" + i));
        }

        Block original = store.original().get(2);
        store.tamper(2, new Block(original.index(), original.timestamp(), entries("forged"),
                original.previousHash(), original.nonce(), original.hash()));

        ChainVerification result = chain.verify();
        assertFalse(result.isValid());
        assertEquals(List.of(2L), result.violatingIndices());

        ChainIntegrityException ex = assertThrows(ChainIntegrityException.class, chain::verifyOrThrow);
        assertEquals(2L, ex.violations().get(0).index());
    }

    @Test
    void earlierSnapshotsAreUnchangedByLaterAppends() {
        Chain chain = new Chain(new InMemoryChainStore(), new ProofOfWork(1));
        chain.append(entries("a"));
        List<Block> before = chain.blocks();

        chain.append(entries("b"));
        chain.append(entries("c"));

        List<Block> after = chain.blocks();
        assertEquals(before, after.subList(0, before.size()));
    }

    @Test
    void payloadPassedToAppendIsCopied() {
        Chain chain = new Chain(new InMemoryChainStore(), new ProofOfWork(1));
        List<JsonNode> payload = entries("x", "y");

        Block block = chain.append(payload);
        payload.set(0, TextNode.valueOf("changed"));

        assertEquals(entries("x", "y"), block.payload());
        assertTrue(chain.verify().isValid());
    }

    @Test
    void listenersSeeEveryAppendAndFailuresDoNotAbort() {
        Chain chain = new Chain(new InMemoryChainStore(), new ProofOfWork(1));
        List<Long> seen = Collections.synchronizedList(new ArrayList<>());
        chain.addListener(block -> {
            throw new IllegalStateException("listener boom");
        });
        chain.addListener(block -> seen.add(block.index()));

        chain.append(entries("a"));
        chain.append(entries("b"));

        assertEquals(List.of(1L, 2L), seen);
        assertEquals(3, chain.size());
    }

    @Test
    void exhaustedCapThrowsMiningTimeout() {
        MiningTimeoutException ex = assertThrows(MiningTimeoutException.class,
                () -> new Chain(new InMemoryChainStore(), new ProofOfWork(16), 10));
        assertEquals(0L, ex.index());
        assertEquals(10L, ex.attempts());
    }

    @Test
    void capIsEnoughWhenNonceFoundInTime() {
        InMemoryChainStore store = new InMemoryChainStore();
        new Chain(store, new ProofOfWork(0));
        Chain capped = new Chain(store, new ProofOfWork(0), 1);
        capped.append(entries("fits in one try"));
        assertEquals(2, capped.size());
    }

    @Test
    void reopeningStoreKeepsExistingGenesis() {
        InMemoryChainStore store = new InMemoryChainStore();
        Chain first = new Chain(store, new ProofOfWork(1));
        first.append(entries("a"));

        Chain second = new Chain(store, new ProofOfWork(1));

        assertEquals(2, second.size());
        assertEquals(first.blocks(), second.blocks());
    }

    @Test
    void tamperedStoreIsRejectedAtStartup() {
        TamperableChainStore store = new TamperableChainStore();
        Chain chain = new Chain(store, new ProofOfWork(1));
        chain.append(entries("a"));

        Block original = store.original().get(1);
        store.tamper(1, new Block(1, original.timestamp(), entries("b"),
                original.previousHash(), original.nonce(), original.hash()));

        assertThrows(ChainIntegrityException.class, () -> new Chain(store, new ProofOfWork(1)));
    }

    @Test
    void missingBlockIsReportedAndStartupRefused() {
        TamperableChainStore store = new TamperableChainStore();
        Chain chain = new Chain(store, new ProofOfWork(1));
        for (int i = 0; i < 4; i++) {
            chain.append(entries("e" + i));
        }
        store.drop(2);

        ChainVerification result = chain.verify();
        assertFalse(result.isValid());
        assertEquals(5, result.length());
        assertEquals(List.of(2L), result.violatingIndices());
        assertEquals(Violation.Type.MISSING, result.violations().get(0).type());

        assertThrows(IllegalStateException.class, chain::blocks);
        assertThrows(ChainIntegrityException.class, () -> new Chain(store, new ProofOfWork(1)));
    }

    @Test
    void undecodableBlockIsReportedAsMalformed() {
        TamperableChainStore store = new TamperableChainStore();
        Chain chain = new Chain(store, new ProofOfWork(1));
        for (int i = 0; i < 3; i++) {
            chain.append(entries("e" + i));
        }
        store.corrupt(1);

        ChainVerification result = chain.verify();
        assertEquals(List.of(1L), result.violatingIndices());
        assertEquals(Violation.Type.MALFORMED, result.violations().get(0).type());

        ChainIntegrityException ex = assertThrows(ChainIntegrityException.class,
                () -> new Chain(store, new ProofOfWork(1)));
        assertEquals(1L, ex.violations().get(0).index());
    }

    @Test
    void concurrentAppendsStayLinked() throws Exception {
        Chain chain = new Chain(new InMemoryChainStore(), new ProofOfWork(1));
        int threads = 4;
        int perThread = 5;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int id = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        chain.append(entries("t" + id + "-" + i));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) f.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1 + threads * perThread, chain.size());
        assertTrue(chain.verify().isValid());
    }
}
