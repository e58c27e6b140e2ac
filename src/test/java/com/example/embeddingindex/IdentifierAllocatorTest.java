package com.example.embeddingindex;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.support.TransactionTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(properties = "spring.datasource.url=jdbc:h2:mem:allocator-test;DB_CLOSE_DELAY=-1")
public class IdentifierAllocatorTest {

    @Autowired
    private IdentifierAllocator allocator;

    @Autowired
    private StoreLock storeLock;

    @Autowired
    private TransactionTemplate tx;

    @Autowired
    private EmbeddingStore store;

    @Test
    public void sameKeyResolvesToSameId() {
        try (StoreLock.Guard ignored = storeLock.acquire()) {
            Long first = tx.execute(s -> allocator.resolveOrCreate("alloc", "a"));
            Long again = tx.execute(s -> allocator.resolveOrCreate("alloc", "a"));
            Long other = tx.execute(s -> allocator.resolveOrCreate("alloc", "b"));
            assertThat(again).isEqualTo(first);
            assertThat(other).isNotEqualTo(first);
        }
        assertThat(allocator.resolve("alloc", "a")).isPresent();
        assertThat(allocator.resolve("alloc", "missing")).isEmpty();
    }

    @Test
    public void releasedIdsAreNeverReused() {
        store.upsertItem(new StoredItem("reuse", "x", "k", "image/png", null, 1), new float[]{1f, 0f});
        long firstId = allocator.resolve("reuse", "x").orElseThrow();
        store.deleteItem("reuse", "x");
        assertThat(allocator.resolve("reuse", "x")).isEmpty();

        store.upsertItem(new StoredItem("reuse", "x", "k", "image/png", null, 1), new float[]{1f, 0f});
        assertThat(allocator.resolve("reuse", "x")).hasValueSatisfying(id -> assertThat(id).isGreaterThan(firstId));
    }

    @Test
    public void mutationsNeedTheLockAndATransaction() {
        assertThatThrownBy(() -> tx.execute(s -> allocator.resolveOrCreate("alloc", "nolock")))
                .isInstanceOf(IllegalStateException.class);
        try (StoreLock.Guard ignored = storeLock.acquire()) {
            assertThatThrownBy(() -> allocator.resolveOrCreate("alloc", "notx"))
                    .isInstanceOf(IllegalTransactionStateException.class);
        }
        assertThat(allocator.resolve("alloc", "nolock")).isEmpty();
    }
}
