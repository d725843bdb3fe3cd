package com.mini.crocolake.catalog;

import java.nio.file.Path;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 数据库代号
 * 
 * 格式为 {序号}_{领域}_{来源}-{质控策略}，例如 1003_BGC_ARGO-QC。
 * 下载解压后的数据位于 {数据根目录}/{代号}/ 下，可直接交给 DatasetReader 打开。
 */
public final class DatabaseCodename {
    
    private static final Pattern CODENAME = Pattern.compile("(\\d{3})(\\d)_(.+)");
    
    private static final String DEV_SUFFIX = "-DEV";
    
    private final String codename;
    
    private DatabaseCodename(String codename) {
        this.codename = codename;
    }
    
    /**
     * 解析数据库代号
     * 
     * @param database 数据库
     * @param domain 领域
     * @param qc true 表示只含质控后观测的版本；CrocoLake 只提供质控版本
     * @param dev true 表示开发版本（序号末位减一并加 -DEV 后缀）
     * @throws IllegalArgumentException CrocoLake 请求了非质控版本
     */
    public static DatabaseCodename of(LakeDatabase database, LakeDatabase.Domain domain, boolean qc, boolean dev) {
        Objects.requireNonNull(database, "Database cannot be null");
        Objects.requireNonNull(domain, "Domain cannot be null");
        
        String stable;
        switch (database) {
            case CROCOLAKE:
                if (!qc) {
                    throw new IllegalArgumentException("CrocoLake database available only with QC.");
                }
                stable = "0007_" + domain.name() + "_CROCOLAKE-QC-MERGED";
                break;
            case ARGO:
                stable = qc
                    ? "1003_" + domain.name() + "_ARGO-QC"
                    : "1011_" + domain.name() + "_ARGO-CLOUD";
                break;
            default:
                throw new IllegalArgumentException("Unsupported database: " + database);
        }
        
        return new DatabaseCodename(dev ? toDev(stable) : stable);
    }
    
    public static DatabaseCodename of(String database, String domain, boolean qc) {
        return of(LakeDatabase.fromName(database), LakeDatabase.Domain.fromName(domain), qc, false);
    }
    
    /**
     * 开发版本的序号比稳定版本小一
     */
    private static String toDev(String stable) {
        Matcher matcher = CODENAME.matcher(stable);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Codename does not match the expected format: " + stable);
        }
        int last = Integer.parseInt(matcher.group(2)) - 1;
        if (last < 0) {
            throw new IllegalArgumentException("No development version precedes " + stable);
        }
        return matcher.group(1) + last + "_" + matcher.group(3) + DEV_SUFFIX;
    }
    
    public String getCodename() {
        return codename;
    }
    
    public boolean isDev() {
        return codename.endsWith(DEV_SUFFIX);
    }
    
    /**
     * 数据集在本地的目录
     */
    public Path localPath(Path dataRoot) {
        return dataRoot.resolve(codename);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DatabaseCodename)) return false;
        return codename.equals(((DatabaseCodename) o).codename);
    }
    
    @Override
    public int hashCode() {
        return codename.hashCode();
    }
    
    @Override
    public String toString() {
        return codename;
    }
}
