package com.example.scan2doc.config;

import com.example.scan2doc.util.layout.LayoutConfig;
import com.example.scan2doc.util.pdf.FontLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 文档生成相关的 Bean
 */
@Slf4j
@Configuration
public class DocGenConfig {

    /**
     * 版面阈值：配置了 JSON 文件时覆盖默认值，文件缺失或格式错误时使用默认值
     */
    @Bean
    public LayoutConfig layoutConfig(@Value("${scan2doc.layout.config-file:}") String configFile) {
        if (configFile == null || configFile.trim().isEmpty()) {
            return LayoutConfig.loadDefault();
        }
        log.info("加载版面配置: {}", configFile);
        return LayoutConfig.loadFromJson(configFile.trim());
    }

    /**
     * 字体加载器（进程内缓存字体字节）
     */
    @Bean
    public FontLoader fontLoader(@Value("${scan2doc.font.retries:3}") int retries,
                                 @Value("${scan2doc.font.backoff-ms:500}") long backoffMs) {
        return new FontLoader(retries, backoffMs);
    }
}
