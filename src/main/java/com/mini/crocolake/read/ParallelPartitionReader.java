package com.mini.crocolake.read;

import com.mini.crocolake.data.Row;
import com.mini.crocolake.format.PartitionFile;
import com.mini.crocolake.format.PartitionFileReader;
import com.mini.crocolake.predicate.Predicate;
import com.mini.crocolake.schema.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 分区读取器
 * 
 * 每个分区由一个任务读取，任务之间不共享可变状态。
 * 并行模式下任务提交到固定大小的线程池，结果按分区序号拼接，
 * 因此输出与串行模式完全一致。任一任务失败时取消其余任务并抛出第一个失败。
 */
public class ParallelPartitionReader implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ParallelPartitionReader.class);
    
    private final Schema selectedSchema;
    @Nullable
    private final Predicate predicate;
    private final boolean useStatistics;
    private final int parallelism;
    
    private ExecutorService executorService;
    
    public ParallelPartitionReader(Schema selectedSchema, @Nullable Predicate predicate,
                                   boolean useStatistics, int parallelism) {
        this.selectedSchema = selectedSchema;
        this.predicate = predicate;
        this.useStatistics = useStatistics;
        this.parallelism = Math.max(1, parallelism);
    }
    
    /**
     * 在调用线程中依次读取各分区
     */
    public List<Row> readSerial(List<PartitionFile> partitions) throws IOException {
        long startTime = System.currentTimeMillis();
        List<Row> allRows = new ArrayList<>();
        for (PartitionFile partition : partitions) {
            allRows.addAll(new PartitionReadTask(partition).call());
        }
        logger.info("Serial read completed: {} rows from {} partitions in {} ms",
                   allRows.size(), partitions.size(), System.currentTimeMillis() - startTime);
        return allRows;
    }
    
    /**
     * 并行读取各分区，阻塞直到全部完成
     */
    public List<Row> readParallel(List<PartitionFile> partitions) throws IOException {
        if (partitions.isEmpty()) {
            return Collections.emptyList();
        }
        
        logger.info("Starting parallel read of {} partitions with parallelism {}",
                   partitions.size(), parallelism);
        long startTime = System.currentTimeMillis();
        
        ExecutorService executor = getExecutorService();
        CompletionService<List<Row>> completionService = new ExecutorCompletionService<>(executor);
        Map<Future<List<Row>>, Integer> positions = new HashMap<>();
        List<Future<List<Row>>> futures = new ArrayList<>();
        
        for (int i = 0; i < partitions.size(); i++) {
            Future<List<Row>> future = completionService.submit(new PartitionReadTask(partitions.get(i)));
            positions.put(future, i);
            futures.add(future);
        }
        
        // 按完成顺序收集，按分区序号存放
        List<List<Row>> results = new ArrayList<>(Collections.nCopies(partitions.size(), null));
        try {
            for (int done = 0; done < partitions.size(); done++) {
                Future<List<Row>> future = completionService.take();
                results.set(positions.get(future), future.get());
            }
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new IOException("Parallel read interrupted", e);
        } catch (ExecutionException e) {
            cancelAll(futures);
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IOException("Parallel read failed: " + cause.getMessage(), cause);
        }
        
        List<Row> allRows = new ArrayList<>();
        for (List<Row> partitionRows : results) {
            allRows.addAll(partitionRows);
        }
        
        logger.info("Parallel read completed: {} rows from {} partitions in {} ms",
                   allRows.size(), partitions.size(), System.currentTimeMillis() - startTime);
        return allRows;
    }
    
    private static void cancelAll(List<Future<List<Row>>> futures) {
        for (Future<List<Row>> future : futures) {
            future.cancel(true);
        }
    }
    
    private synchronized ExecutorService getExecutorService() {
        if (executorService == null) {
            executorService = createExecutorService(parallelism);
        }
        return executorService;
    }
    
    /**
     * 创建线程池
     */
    private static ExecutorService createExecutorService(int parallelism) {
        return new ThreadPoolExecutor(
            parallelism, parallelism,
            60L, TimeUnit.SECONDS,
            new LinkedBlockingQueue<>(),
            new ThreadFactory() {
                private final AtomicInteger threadNumber = new AtomicInteger(1);
                @Override
                public Thread newThread(Runnable r) {
                    Thread t = new Thread(r, "partition-reader-" + threadNumber.getAndIncrement());
                    t.setDaemon(true);
                    return t;
                }
            }
        );
    }
    
    @Override
    public synchronized void close() {
        if (executorService != null) {
            executorService.shutdown();
            try {
                if (!executorService.awaitTermination(10, TimeUnit.SECONDS)) {
                    executorService.shutdownNow();
                }
            } catch (InterruptedException e) {
                executorService.shutdownNow();
                Thread.currentThread().interrupt();
            }
            executorService = null;
        }
    }
    
    /**
     * 单个分区的读取任务
     */
    private class PartitionReadTask implements Callable<List<Row>> {
        private final PartitionFile partition;
        
        PartitionReadTask(PartitionFile partition) {
            this.partition = partition;
        }
        
        @Override
        public List<Row> call() throws IOException {
            if (predicate != null && useStatistics && partition.hasStatistics()
                    && !predicate.mightMatch(partition.getStatistics())) {
                logger.debug("Skipped partition {} by statistics", partition.getPath().getFileName());
                return Collections.emptyList();
            }
            
            List<Row> rows = new ArrayList<>();
            try (PartitionFileReader reader = new PartitionFileReader(partition, selectedSchema, predicate)) {
                Row row;
                while ((row = reader.readRecord()) != null) {
                    rows.add(row);
                }
                logger.debug("Read partition {}: scanned {} rows, kept {}",
                            partition.getPath().getFileName(), reader.getScannedRows(), reader.getReturnedRows());
            } catch (IOException e) {
                logger.error("Failed to read partition: " + partition.getPath(), e);
                throw e;
            }
            return rows;
        }
    }
}
