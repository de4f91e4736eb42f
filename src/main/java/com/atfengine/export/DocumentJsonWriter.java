package com.atfengine.export;

import com.atfengine.config.ParserConfig;
import com.atfengine.parse.AtfParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.File;
import java.io.IOException;

/**
 * 将解析结果序列化为展示层使用的 JSON。
 */
public class DocumentJsonWriter {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private final ObjectWriter writer;

    public DocumentJsonWriter() {
        this(ParserConfig.defaults());
    }

    public DocumentJsonWriter(ParserConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("解析配置不能为空");
        }
        this.writer = config.isPrettyPrint()
            ? OBJECT_MAPPER.writerWithDefaultPrettyPrinter()
            : OBJECT_MAPPER.writer();
    }

    /**
     * 序列化为 JSON 字符串。
     *
     * @throws IOException 序列化失败时抛出
     */
    public String toJson(AtfParser.ParseResult result) throws IOException {
        if (result == null) {
            throw new IllegalArgumentException("解析结果不能为空");
        }
        try {
            return writer.writeValueAsString(result);
        } catch (JsonProcessingException exception) {
            throw new IOException("序列化解析结果失败", exception);
        }
    }

    /**
     * 将解析结果写入指定 JSON 文件。
     *
     * @param result 解析结果
     * @param file   目标文件
     * @throws IOException 写入失败时抛出
     */
    public void writeTo(AtfParser.ParseResult result, File file) throws IOException {
        if (result == null || file == null) {
            throw new IllegalArgumentException("解析结果与目标文件不能为空");
        }
        try {
            writer.writeValue(file, result);
        } catch (IOException exception) {
            throw new IOException("写入解析结果失败: " + file.getAbsolutePath(), exception);
        }
    }
}
