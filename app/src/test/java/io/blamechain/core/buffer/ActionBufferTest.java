package io.blamechain.core.buffer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.blamechain.core.consensus.ProofOfWork;
import io.blamechain.core.node.Chain;
import io.blamechain.core.protocol.Block;
import io.blamechain.core.storage.ChainStore;
import io.blamechain.core.storage.InMemoryChainStore;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class ActionBufferTest {

    private static Chain newChain() {
        return new Chain(new InMemoryChainStore(), new ProofOfWork(1));
    }

    private static JsonNode text(String s) {
        return TextNode.valueOf(s);
    }

    @Test
    void thresholdFlushSealsEntriesInOrder() {
        Chain chain = newChain();
        ActionBuffer buffer = new ActionBuffer(chain, new EntryValidator(), 3);

        assertTrue(buffer.enqueue(text("A")).isEmpty());
        assertTrue(buffer.enqueue(text("B")).isEmpty());
        Optional<Block> mined = buffer.enqueue(text("C"));

        assertTrue(mined.isPresent());
        assertEquals(List.of(text("A"), text("B"), text("C")), mined.get().payload());
        assertEquals(2, chain.size());
        assertEquals(0, buffer.size());
        assertEquals(mined.get(), chain.head());
    }

    @Test
    void belowThresholdStaysPending() {
        Chain chain = newChain();
        ActionBuffer buffer = new ActionBuffer(chain, new EntryValidator(), 3);

        buffer.enqueue(text("A"));
        buffer.enqueue(text("B"));

        assertEquals(1, chain.size());
        assertEquals(List.of(text("A"), text("B")), buffer.pending());
    }

    @Test
    void enqueueOrderSurvivesAcrossBlocks() {
        Chain chain = newChain();
        ActionBuffer buffer = new ActionBuffer(chain, new EntryValidator(), 3);
        List<JsonNode> sent = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            JsonNode entry = text("e" + i);
            sent.add(entry);
            buffer.enqueue(entry);
        }
        buffer.flush();

        List<JsonNode> onChain = new ArrayList<>();
        for (Block block : chain.blocks()) onChain.addAll(block.payload());

        assertEquals(sent, onChain);
        assertEquals(5, chain.size());
        assertTrue(chain.verify().isValid());
    }

    @Test
    void flushSealsPartialBatch() {
        Chain chain = newChain();
        ActionBuffer buffer = new ActionBuffer(chain, new EntryValidator(), 3);
        buffer.enqueue(text("only"));

        Block block = buffer.flush().orElseThrow();

        assertEquals(List.of(text("only")), block.payload());
        assertEquals(0, buffer.size());
        assertTrue(buffer.flush().isEmpty());
        assertEquals(2, chain.size());
    }

    @Test
    void pendingSnapshotIsDetached() {
        ActionBuffer buffer = new ActionBuffer(newChain(), new EntryValidator(), 3);
        ObjectNode entry = JsonNodeFactory.instance.objectNode().put("actor", "bot-7");
        buffer.enqueue(entry);

        entry.put("actor", "someone-else");
        ((ObjectNode) buffer.pending().get(0)).put("actor", "mutated");

        assertEquals("bot-7", buffer.pending().get(0).get("actor").asText());
    }

    @Test
    void rejectsMissingAndOversizeEntries() {
        Chain chain = newChain();
        ActionBuffer buffer = new ActionBuffer(chain, new EntryValidator(16), 3);

        assertThrows(EntryRejectedException.class, () -> buffer.enqueue(null));
        assertThrows(EntryRejectedException.class,
                () -> buffer.enqueue(JsonNodeFactory.instance.missingNode()));
        assertThrows(EntryRejectedException.class, () -> buffer.enqueue(text("x".repeat(64))));
        assertEquals(0, buffer.size());
    }

    @Test
    void rejectsNonPositiveThreshold() {
        Chain chain = newChain();
        assertThrows(IllegalArgumentException.class, () -> new ActionBuffer(chain, new EntryValidator(), 0));
    }

    @Test
    void failedSealPutsBatchBackInOrder() {
        FlakyChainStore store = new FlakyChainStore();
        Chain chain = new Chain(store, new ProofOfWork(1));
        ActionBuffer buffer = new ActionBuffer(chain, new EntryValidator(), 2);

        buffer.enqueue(text("A"));
        store.failing.set(true);
        assertThrows(IllegalStateException.class, () -> buffer.enqueue(text("B")));

        assertEquals(List.of(text("A"), text("B")), buffer.pending());
        assertEquals(1, chain.size());

        store.failing.set(false);
        Block block = buffer.enqueue(text("C")).orElseThrow();
        assertEquals(List.of(text("A"), text("B"), text("C")), block.payload());
        assertEquals(0, buffer.size());
    }

    @Test
    void backlogAfterOutageIsSealedInCappedBlocks() {
        FlakyChainStore store = new FlakyChainStore();
        Chain chain = new Chain(store, new ProofOfWork(1));
        ActionBuffer buffer = new ActionBuffer(chain, new EntryValidator(), 3, 5);

        store.failing.set(true);
        List<JsonNode> sent = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            JsonNode entry = text("e" + i);
            sent.add(entry);
            if (i < 2) {
                buffer.enqueue(entry);
            } else {
                assertThrows(IllegalStateException.class, () -> buffer.enqueue(entry));
            }
        }
        assertEquals(12, buffer.size());

        store.failing.set(false);
        JsonNode last = text("e12");
        sent.add(last);
        Block newest = buffer.enqueue(last).orElseThrow();

        // 13 pending: two blocks of 5, then 3 left which still meets the threshold
        assertEquals(0, buffer.size());
        assertEquals(4, chain.size());
        assertEquals(chain.head(), newest);

        List<JsonNode> onChain = new ArrayList<>();
        for (Block block : chain.blocks()) {
            assertTrue(block.payload().size() <= 5);
            onChain.addAll(block.payload());
        }
        assertEquals(sent, onChain);
        assertTrue(chain.verify().isValid());
    }

    @Test
    void flushDrainsBacklogBelowThreshold() {
        FlakyChainStore store = new FlakyChainStore();
        Chain chain = new Chain(store, new ProofOfWork(1));
        ActionBuffer buffer = new ActionBuffer(chain, new EntryValidator(), 4, 4);

        store.failing.set(true);
        for (int i = 0; i < 6; i++) {
            JsonNode entry = text("e" + i);
            try {
                buffer.enqueue(entry);
            } catch (IllegalStateException expected) {
                // still pending
            }
        }
        assertEquals(6, buffer.size());

        store.failing.set(false);
        Block last = buffer.flush().orElseThrow();

        assertEquals(List.of(text("e4"), text("e5")), last.payload());
        assertEquals(3, chain.size());
        assertEquals(0, buffer.size());
    }

    @Test
    void concurrentProducersLoseNothing() throws Exception {
        Chain chain = newChain();
        ActionBuffer buffer = new ActionBuffer(chain, new EntryValidator(), 4);
        int producers = 4;
        int perProducer = 25;
        ExecutorService pool = Executors.newFixedThreadPool(producers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int p = 0; p < producers; p++) {
                int id = p;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perProducer; i++) {
                        buffer.enqueue(text(id + ":" + i));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) f.get(60, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
        buffer.flush();

        List<String> onChain = new ArrayList<>();
        for (Block block : chain.blocks()) {
            for (JsonNode entry : block.payload()) onChain.add(entry.asText());
        }
        assertEquals(producers * perProducer, onChain.size());
        assertEquals(producers * perProducer, new HashSet<>(onChain).size());

        // each producer's own entries stay in the order it sent them
        for (int p = 0; p < producers; p++) {
            int last = -1;
            for (String value : onChain) {
                String[] parts = value.split(":");
                if (Integer.parseInt(parts[0]) != p) continue;
                int seq = Integer.parseInt(parts[1]);
                assertTrue(seq > last, "out of order for producer " + p);
                last = seq;
            }
        }
        assertTrue(chain.verify().isValid());
    }

    /** Accepts genesis, then fails appends while {@code failing} is set. */
    private static final class FlakyChainStore implements ChainStore {
        final AtomicBoolean failing = new AtomicBoolean();
        private final InMemoryChainStore delegate = new InMemoryChainStore();

        @Override
        public void append(Block block) {
            if (failing.get()) throw new IllegalStateException("persist-failure");
            delegate.append(block);
        }

        @Override
        public Optional<Block> get(long index) {
            return delegate.get(index);
        }

        @Override
        public long size() {
            return delegate.size();
        }
    }
}
