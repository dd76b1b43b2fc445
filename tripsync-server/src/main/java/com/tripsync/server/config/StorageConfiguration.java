package com.tripsync.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripsync.common.properties.StorageProperties;
import com.tripsync.server.backup.BackupCatalog;
import com.tripsync.server.backup.JsonFileBackupCatalog;
import com.tripsync.server.storage.CorruptedJsonRecovery;
import com.tripsync.server.storage.TripFilePaths;
import com.tripsync.server.storage.TripWriteQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 存储层装配：数据目录、写线程池、写队列、备份目录。
 */
@Configuration
@Slf4j
public class StorageConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TripFilePaths tripFilePaths(StorageProperties storageProperties) {
        Path dataDir = Paths.get(storageProperties.getDataDir());
        log.info("行程数据目录: {}", dataDir.toAbsolutePath());
        return new TripFilePaths(dataDir, storageProperties.getBackupDirName());
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService tripWriteExecutor(StorageProperties storageProperties) {
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "trip-writer-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(Math.max(1, storageProperties.getWriteThreads()), factory);
    }

    @Bean
    public TripWriteQueue tripWriteQueue(ExecutorService tripWriteExecutor) {
        return new TripWriteQueue(tripWriteExecutor);
    }

    @Bean
    public CorruptedJsonRecovery corruptedJsonRecovery(ObjectMapper objectMapper) {
        return new CorruptedJsonRecovery(objectMapper);
    }

    @Bean
    public BackupCatalog backupCatalog(TripFilePaths tripFilePaths, StorageProperties storageProperties,
                                       ObjectMapper objectMapper, Clock clock) {
        return new JsonFileBackupCatalog(tripFilePaths.getDataDir(), storageProperties.getCatalogFileName(),
                objectMapper, clock);
    }
}
