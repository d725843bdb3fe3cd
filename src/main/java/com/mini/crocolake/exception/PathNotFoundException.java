package com.mini.crocolake.exception;

import java.nio.file.Path;

/**
 * 数据集路径不存在，或路径下没有任何分区文件
 */
public class PathNotFoundException extends MiniLakeException {
    
    private final Path path;
    
    public PathNotFoundException(Path path, String message) {
        super(message + ": " + path);
        this.path = path;
    }
    
    public Path getPath() {
        return path;
    }
}
