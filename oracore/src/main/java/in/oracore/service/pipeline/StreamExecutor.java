package in.oracore.service.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Sharded worker pool. Each shard is a single thread and an owner key always maps to the same
 * shard, so all work for one owner runs sequentially in submission order while different
 * owners proceed in parallel.
 */
public final class StreamExecutor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StreamExecutor.class);

    private final ExecutorService[] shards;

    public StreamExecutor(int shardCount) {
        if (shardCount < 1) {
            throw new IllegalArgumentException("shardCount must be >= 1: " + shardCount);
        }
        this.shards = new ExecutorService[shardCount];
        for (int i = 0; i < shardCount; i++) {
            int shard = i;
            shards[i] = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable, "stream-worker-" + shard);
                thread.setDaemon(true);
                return thread;
            });
        }
    }

    public <T> CompletableFuture<T> submit(String ownerKey, Supplier<T> task) {
        return CompletableFuture.supplyAsync(task, shards[shardOf(ownerKey)]);
    }

    int shardOf(String ownerKey) {
        return Math.floorMod(ownerKey.hashCode(), shards.length);
    }

    public int shardCount() {
        return shards.length;
    }

    @Override
    public void close() {
        for (ExecutorService shard : shards) {
            shard.shutdown();
        }
        try {
            for (ExecutorService shard : shards) {
                if (!shard.awaitTermination(30, TimeUnit.SECONDS)) {
                    log.warn("Stream worker did not finish in time; forcing shutdown");
                    shard.shutdownNow();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            for (ExecutorService shard : shards) {
                shard.shutdownNow();
            }
        }
    }
}
