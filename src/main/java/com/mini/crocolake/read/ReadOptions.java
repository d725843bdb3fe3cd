package com.mini.crocolake.read;

import java.util.Map;
import java.util.Objects;

/**
 * 读取配置选项
 */
public class ReadOptions {
    
    public static final String PARALLELISM = "read.parallelism";
    public static final String FILE_EXTENSION = "read.file-extension";
    public static final String INCLUDE_SUBFOLDERS = "read.include-subfolders";
    public static final String USE_STATISTICS = "read.use-statistics";
    
    public static final String DEFAULT_FILE_EXTENSION = ".csv";
    
    /** 并行读取的工作线程数，默认为可用处理器数 */
    private final int parallelism;
    
    /** 分区文件扩展名，默认 .csv */
    private final String fileExtension;
    
    /** 是否递归查找子目录中的分区文件，默认 false */
    private final boolean includeSubfolders;
    
    /** 是否使用统计信息跳过分区，默认 true */
    private final boolean useStatistics;
    
    public ReadOptions() {
        this(defaultParallelism(), DEFAULT_FILE_EXTENSION, false, true);
    }
    
    public ReadOptions(int parallelism, String fileExtension,
                       boolean includeSubfolders, boolean useStatistics) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be positive: " + parallelism);
        }
        this.parallelism = parallelism;
        this.fileExtension = normalizeExtension(Objects.requireNonNull(fileExtension, "File extension cannot be null"));
        this.includeSubfolders = includeSubfolders;
        this.useStatistics = useStatistics;
    }
    
    public static ReadOptions defaults() {
        return new ReadOptions();
    }
    
    /**
     * 从字符串键值对创建配置，未出现的键取默认值
     */
    public static ReadOptions fromMap(Map<String, String> options) {
        Builder builder = builder();
        String parallelism = options.get(PARALLELISM);
        if (parallelism != null) {
            try {
                builder.parallelism(Integer.parseInt(parallelism.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + PARALLELISM + ": " + parallelism, e);
            }
        }
        String extension = options.get(FILE_EXTENSION);
        if (extension != null) {
            builder.fileExtension(extension);
        }
        String subfolders = options.get(INCLUDE_SUBFOLDERS);
        if (subfolders != null) {
            builder.includeSubfolders(parseBoolean(INCLUDE_SUBFOLDERS, subfolders));
        }
        String statistics = options.get(USE_STATISTICS);
        if (statistics != null) {
            builder.useStatistics(parseBoolean(USE_STATISTICS, statistics));
        }
        return builder.build();
    }
    
    private static boolean parseBoolean(String key, String value) {
        String trimmed = value.trim();
        if ("true".equalsIgnoreCase(trimmed)) {
            return true;
        }
        if ("false".equalsIgnoreCase(trimmed)) {
            return false;
        }
        throw new IllegalArgumentException("Invalid value for " + key + ": " + value);
    }
    
    private static String normalizeExtension(String extension) {
        String trimmed = extension.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("File extension cannot be empty");
        }
        return trimmed.startsWith(".") ? trimmed : "." + trimmed;
    }
    
    private static int defaultParallelism() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }
    
    public int getParallelism() {
        return parallelism;
    }
    
    public String getFileExtension() {
        return fileExtension;
    }
    
    public boolean isIncludeSubfolders() {
        return includeSubfolders;
    }
    
    public boolean isUseStatistics() {
        return useStatistics;
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private int parallelism = defaultParallelism();
        private String fileExtension = DEFAULT_FILE_EXTENSION;
        private boolean includeSubfolders = false;
        private boolean useStatistics = true;
        
        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }
        
        public Builder fileExtension(String fileExtension) {
            this.fileExtension = fileExtension;
            return this;
        }
        
        public Builder includeSubfolders(boolean includeSubfolders) {
            this.includeSubfolders = includeSubfolders;
            return this;
        }
        
        public Builder useStatistics(boolean useStatistics) {
            this.useStatistics = useStatistics;
            return this;
        }
        
        public ReadOptions build() {
            return new ReadOptions(parallelism, fileExtension, includeSubfolders, useStatistics);
        }
    }
    
    @Override
    public String toString() {
        return "ReadOptions{" +
                "parallelism=" + parallelism +
                ", fileExtension='" + fileExtension + '\'' +
                ", includeSubfolders=" + includeSubfolders +
                ", useStatistics=" + useStatistics +
                '}';
    }
}
