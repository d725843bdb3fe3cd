package com.mini.crocolake.format;

import java.io.Closeable;
import java.io.IOException;

/**
 * Record Reader Interface
 * 统一的流式记录读取接口
 */
public interface RecordReader<T> extends Closeable {
    
    /**
     * 读取下一条记录
     * 
     * @return 下一条记录，如果没有更多记录返回 null
     * @throws IOException 读取异常
     */
    T readRecord() throws IOException;
    
    /**
     * 关闭读取器，释放资源
     */
    @Override
    void close() throws IOException;
}
