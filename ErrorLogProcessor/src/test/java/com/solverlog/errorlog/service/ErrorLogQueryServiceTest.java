package com.solverlog.errorlog.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.solverlog.errorlog.cache.ResultCache;
import com.solverlog.errorlog.cache.SharedResultCache;
import com.solverlog.errorlog.config.DatabaseSettings;
import com.solverlog.errorlog.exception.ErrorKind;
import com.solverlog.errorlog.exception.ErrorLogException;
import com.solverlog.errorlog.model.ErrorLogEntry;
import com.solverlog.errorlog.model.ErrorLogSummary;
import com.solverlog.errorlog.storage.ErrorLogRepository;
import com.solverlog.errorlog.storage.StorageHandle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.msgpack.jackson.dataformat.MessagePackFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ErrorLogQueryServiceTest {

    private static final Executor DIRECT = Runnable::run;

    private final ObjectMapper msgpack = new ObjectMapper(new MessagePackFactory());

    private final DataSource pool = mock(DataSource.class);

    private ErrorLogRepository repository;
    private SharedResultCache cache;
    private ErrorLogQueryService service;

    @BeforeEach
    void setUp() {
        repository = mock(ErrorLogRepository.class);
        cache = new SharedResultCache(new ResultCache(4));
        service = new ErrorLogQueryService(repository, cache, msgpack, DIRECT, DIRECT);

        when(repository.withStorage(any()))
            .thenAnswer(inv -> inv.<Function<DataSource, Object>>getArgument(0).apply(pool));
        when(repository.findSummary(pool, 1L)).thenReturn(List.of(
            ErrorLogSummary.builder().load(1.5).iters(1).cost(60.0).build(),
            ErrorLogSummary.builder().load(1.2).iters(2).cost(null).build()));
        when(repository.findEntries(pool, 1L)).thenReturn(List.of(
            ErrorLogEntry.builder().iters(1).load(1.5).errorU(0.1).errorPhi(0.2).build(),
            ErrorLogEntry.builder().iters(2).load(1.2).errorU(0.05).errorPhi(0.15).build()));
    }

    @Test
    void miss_deliversPositionalPayload_thenCachesIt() throws Exception {
        List<byte[]> delivered = new ArrayList<>();

        service.queryAggregate(1L, delivered::add);

        assertEquals(1, delivered.size());
        JsonNode root = msgpack.readTree(delivered.get(0));
        assertTrue(root.isArray());
        assertEquals(2, root.size());

        JsonNode summary = root.get(0);
        assertEquals(1.5, summary.get(0).get(0).asDouble(), 1e-9);
        assertEquals(1, summary.get(0).get(1).asInt());
        assertEquals(60.0, summary.get(0).get(2).asDouble(), 1e-9);
        assertTrue(summary.get(1).get(2).isNull());

        JsonNode entries = root.get(1);
        assertEquals(2, entries.size());
        assertEquals(2, entries.get(1).get(0).asInt());
        assertEquals(1.2, entries.get(1).get(1).asDouble(), 1e-9);
        assertEquals(0.05, entries.get(1).get(2).asDouble(), 1e-9);
        assertEquals(0.15, entries.get(1).get(3).asDouble(), 1e-9);

        assertArrayEquals(delivered.get(0), cache.get(1L).orElseThrow());
    }

    @Test
    void hit_servesCachedBytes_withoutStorage() throws Exception {
        cache.set(1L, new byte[]{7, 7});
        List<byte[]> delivered = new ArrayList<>();

        service.queryAggregate(1L, delivered::add);

        assertArrayEquals(new byte[]{7, 7}, delivered.get(0));
        verifyNoInteractions(repository);
    }

    @Test
    void secondQuery_isServedFromCache() throws Exception {
        service.queryAggregate(1L, payload -> { });
        service.queryAggregate(1L, payload -> { });

        verify(repository, times(1)).findSummary(pool, 1L);
        verify(repository, times(1)).findEntries(pool, 1L);
    }

    @Test
    void storageFailure_isReported_andNothingDelivered() {
        when(repository.findEntries(pool, 2L)).thenThrow(new ErrorLogException(ErrorKind.STORAGE, "connection refused"));
        when(repository.findSummary(pool, 2L)).thenReturn(List.of());
        List<byte[]> delivered = new ArrayList<>();

        ErrorLogException e = assertThrows(ErrorLogException.class,
            () -> service.queryAggregate(2L, delivered::add));

        assertEquals(ErrorKind.STORAGE, e.getKind());
        assertTrue(delivered.isEmpty());
        assertFalse(cache.has(2L));
    }

    @Test
    void unexpectedReadFailure_isWrappedAsStorageError() {
        when(repository.findSummary(pool, 3L)).thenThrow(new IllegalStateException("boom"));
        when(repository.findEntries(pool, 3L)).thenReturn(List.of());

        ErrorLogException e = assertThrows(ErrorLogException.class,
            () -> service.queryAggregate(3L, payload -> { }));

        assertEquals(ErrorKind.STORAGE, e.getKind());
    }

    @Test
    void deliveryFailure_isDeliveryError_andNotCached() {
        ErrorLogException e = assertThrows(ErrorLogException.class,
            () -> service.queryAggregate(1L, payload -> {
                throw new IOException("client went away");
            }));

        assertEquals(ErrorKind.DELIVERY, e.getKind());
        assertFalse(cache.has(1L));
    }

    @Test
    void backgroundCacheFailure_doesNotAffectDeliveredResponse() throws Exception {
        SharedResultCache failing = mock(SharedResultCache.class);
        when(failing.get(1L)).thenReturn(Optional.empty());
        doThrow(new ErrorLogException(ErrorKind.STORAGE, "cannot compress"))
            .when(failing).setIfCurrent(eq(1L), any(), anyLong());
        ErrorLogQueryService withFailingCache = new ErrorLogQueryService(repository, failing, msgpack, DIRECT, DIRECT);
        List<byte[]> delivered = new ArrayList<>();

        assertDoesNotThrow(() -> withFailingCache.queryAggregate(1L, delivered::add));

        assertEquals(1, delivered.size());
        verify(failing).setIfCurrent(eq(1L), any(), anyLong());
    }

    @Test
    void rejectedCacheFill_doesNotAffectDeliveredResponse() {
        Executor rejecting = task -> {
            throw new java.util.concurrent.RejectedExecutionException("shutting down");
        };
        ErrorLogQueryService shuttingDown = new ErrorLogQueryService(repository, cache, msgpack, DIRECT, rejecting);
        List<byte[]> delivered = new ArrayList<>();

        assertDoesNotThrow(() -> shuttingDown.queryAggregate(1L, delivered::add));

        assertEquals(1, delivered.size());
        assertFalse(cache.has(1L));
    }

    @Test
    void clearCache_and_evict() {
        cache.set(1L, new byte[]{1});
        cache.set(2L, new byte[]{2});

        service.evict(1L);
        assertFalse(cache.has(1L));
        assertTrue(cache.has(2L));

        service.clearCache();
        assertEquals(0, cache.size());
    }

    @Test
    void totalTime_delegatesToRepository() {
        when(repository.totalTime(1L)).thenReturn(Optional.of(60.0));
        when(repository.totalTime(4L)).thenReturn(Optional.empty());

        assertEquals(Optional.of(60.0), service.totalTime(1L));
        assertTrue(service.totalTime(4L).isEmpty());
    }

    @Test
    void evictionDuringQuery_discardsPendingCacheFill() throws Exception {
        List<Runnable> pendingFills = new ArrayList<>();
        ErrorLogQueryService deferred = new ErrorLogQueryService(repository, cache, msgpack, DIRECT, pendingFills::add);

        deferred.queryAggregate(1L, payload -> { });
        deferred.evict(1L);
        pendingFills.forEach(Runnable::run);

        assertEquals(1, pendingFills.size());
        assertFalse(cache.has(1L));
    }

    @Test
    void bothReadsUseOnePool_andSwapWaitsForThem() throws Exception {
        List<DataSource> pools = new CopyOnWriteArrayList<>();
        StorageHandle handle = new StorageHandle(DatabaseSettings.builder().host("dbA").build(), settings -> {
            DataSource ds = mock(DataSource.class);
            pools.add(ds);
            return ds;
        });
        ExecutorService other = Executors.newSingleThreadExecutor();
        List<Future<?>> swap = new CopyOnWriteArrayList<>();
        AtomicBoolean swappedDuringReads = new AtomicBoolean();
        try {
            when(repository.withStorage(any()))
                .thenAnswer(inv -> handle.withDataSource(inv.<Function<DataSource, Object>>getArgument(0)));
            when(repository.findSummary(any(DataSource.class), eq(5L))).thenAnswer(inv -> {
                swap.add(other.submit(() -> handle.reconfigure(DatabaseSettings.builder().host("dbB").build())));
                Thread.sleep(100);
                return List.of();
            });
            when(repository.findEntries(any(DataSource.class), eq(5L))).thenAnswer(inv -> {
                swappedDuringReads.set(swap.get(0).isDone());
                return List.of();
            });

            service.queryAggregate(5L, payload -> { });
            swap.get(0).get(5, TimeUnit.SECONDS);
        } finally {
            other.shutdownNow();
        }

        assertFalse(swappedDuringReads.get());
        verify(repository).findSummary(pools.get(0), 5L);
        verify(repository).findEntries(pools.get(0), 5L);
        assertEquals("dbB", handle.currentSettings().getHost());
        assertSame(pools.get(1), handle.withDataSource(ds -> ds));
    }
}
