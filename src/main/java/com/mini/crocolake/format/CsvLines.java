package com.mini.crocolake.format;

import java.util.ArrayList;
import java.util.List;

/**
 * CSV 行的拆分与转义
 * 逗号分隔，双引号包围含逗号或引号的单元，引号内用两个双引号表示一个双引号
 */
final class CsvLines {
    
    static final char DELIMITER = ',';
    static final char QUOTE = '"';
    
    private CsvLines() {
    }
    
    /**
     * 解析 CSV 行
     * 处理引号和转义字符
     */
    static List<String> split(String line) {
        List<String> values = new ArrayList<>();
        StringBuilder currentValue = new StringBuilder();
        boolean inQuotes = false;
        boolean lastCharWasQuote = false;
        
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            
            if (c == QUOTE) {
                if (inQuotes) {
                    if (lastCharWasQuote) {
                        // 双引号转义
                        currentValue.append(c);
                        lastCharWasQuote = false;
                    } else {
                        lastCharWasQuote = true;
                    }
                } else {
                    inQuotes = true;
                }
            } else if (c == DELIMITER && (!inQuotes || lastCharWasQuote)) {
                values.add(currentValue.toString());
                currentValue.setLength(0);
                inQuotes = false;
                lastCharWasQuote = false;
            } else {
                if (lastCharWasQuote) {
                    inQuotes = false;
                    lastCharWasQuote = false;
                }
                currentValue.append(c);
            }
        }
        
        values.add(currentValue.toString());
        return values;
    }
    
    /**
     * 每行一条记录，单元格内不能有换行符
     */
    static boolean hasLineBreak(String value) {
        return value != null && (value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0);
    }
    
    /**
     * 转义特殊字符
     */
    static String escape(String value) {
        if (value == null) {
            return "";
        }
        if (value.indexOf(DELIMITER) >= 0 || value.indexOf(QUOTE) >= 0) {
            String quote = String.valueOf(QUOTE);
            return quote + value.replace(quote, quote + quote) + quote;
        }
        return value;
    }
}
