package org.bimexport.export;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 按楼层拆分服务的 Bean 装配。
 * <p>
 * 导出过程（{@link org.bimexport.level.ExportPass}）不是 Bean：每次工具调用按需创建，调用结束即丢弃。
 */
@Configuration(proxyBeanMethods = false)
public class ExportConfiguration {

    @Bean
    public ModelFileResolver modelFileResolver(LevelSplitProperties properties) {
        return new ModelFileResolver(properties.getRoots(), properties.isAllowSymlink());
    }
}
