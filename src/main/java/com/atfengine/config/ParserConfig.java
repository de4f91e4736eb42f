package com.atfengine.config;

/**
 * 解析器运行时配置
 * 
 * 支持从CLI参数注入，覆盖Constants默认值
 */
public class ParserConfig {
    private String defaultObjectType = Constants.DEFAULT_OBJECT_TYPE;
    private String defaultSurfaceName = Constants.DEFAULT_SURFACE_NAME;
    private boolean legendEnabled = true;
    private boolean prettyPrint = true;
    
    public String getDefaultObjectType() {
        return defaultObjectType;
    }
    
    public void setDefaultObjectType(String defaultObjectType) {
        if (defaultObjectType == null || defaultObjectType.isBlank()) {
            throw new IllegalArgumentException("默认载体类型不能为空");
        }
        this.defaultObjectType = defaultObjectType;
    }
    
    public String getDefaultSurfaceName() {
        return defaultSurfaceName;
    }
    
    public void setDefaultSurfaceName(String defaultSurfaceName) {
        if (defaultSurfaceName == null || defaultSurfaceName.isBlank()) {
            throw new IllegalArgumentException("默认表面名不能为空");
        }
        this.defaultSurfaceName = defaultSurfaceName;
    }
    
    public boolean isLegendEnabled() {
        return legendEnabled;
    }
    
    public void setLegendEnabled(boolean legendEnabled) {
        this.legendEnabled = legendEnabled;
    }
    
    public boolean isPrettyPrint() {
        return prettyPrint;
    }
    
    public void setPrettyPrint(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
    }
    
    /**
     * 使用默认配置创建实例
     */
    public static ParserConfig defaults() {
        return new ParserConfig();
    }
}
