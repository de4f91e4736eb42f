package com.atfengine.config;

/**
 * 全局常量定义
 * 
 * 包含文档默认值、表面与栏目命名约定以及命令行输入限制
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }
    
    // ==================== 文档默认值 ====================
    /** 未声明 @object 指令时的载体类型 */
    public static final String DEFAULT_OBJECT_TYPE = "tablet";
    /** 内容先于表面声明出现时自动创建的表面 */
    public static final String DEFAULT_SURFACE_NAME = "obverse";
    /** 隐式栏目编号（未声明 @column 时创建） */
    public static final int IMPLICIT_COLUMN_NUMBER = 0;
    
    // ==================== 表面命名 ====================
    /** @surface 指令统一使用的表面名 */
    public static final String GENERIC_SURFACE_NAME = "surface";
    
    // ==================== 命令行参数 ====================
    /** 命令行单个输入文件大小上限（8MB） */
    public static final long MAX_INPUT_BYTES = 8L * 1024 * 1024;
    /** lookup 子命令单次最多处理的词数 */
    public static final int MAX_LOOKUP_WORDS = 1000;
}
