package com.mini.crocolake.catalog;

/**
 * 可获取的观测数据库
 */
public enum LakeDatabase {
    
    /** Argo 浮标数据（GDAC 的列式版本） */
    ARGO,
    
    /** 多来源合并数据库，目前包含 Argo、GLODAP 和 Spray Gliders */
    CROCOLAKE;
    
    /**
     * 忽略大小写解析数据库名
     */
    public static LakeDatabase fromName(String name) {
        for (LakeDatabase database : values()) {
            if (database.name().equalsIgnoreCase(name.trim())) {
                return database;
            }
        }
        throw new IllegalArgumentException("Invalid database name. Must be 'CROCOLAKE' or 'ARGO': " + name);
    }
    
    /**
     * 观测领域
     */
    public enum Domain {
        /** 物理参数（CTD） */
        PHY,
        /** 生物地球化学参数 */
        BGC;
        
        public static Domain fromName(String name) {
            for (Domain domain : values()) {
                if (domain.name().equalsIgnoreCase(name.trim())) {
                    return domain;
                }
            }
            throw new IllegalArgumentException("Invalid database type. Must be 'PHY' or 'BGC': " + name);
        }
    }
}
