package com.yerin.openshow.config;

import com.yerin.openshow.domain.JobStatus;
import com.yerin.openshow.web.AdminTokenInterceptor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.Locale;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

    static final String ADMIN_PATHS = "/admin/**";
    static final String[] UNGUARDED_PATHS = {"/actuator/**", "/swagger-ui/**", "/v3/api-docs/**"};

    private final AdminTokenInterceptor adminTokenInterceptor;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(adminTokenInterceptor)
                .addPathPatterns(ADMIN_PATHS)
                .excludePathPatterns(UNGUARDED_PATHS);
    }

    // ?status=dlq 와 ?status=DLQ 모두 허용
    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(String.class, JobStatus.class, new JobStatusConverter());
    }

    static class JobStatusConverter implements Converter<String, JobStatus> {
        @Override
        public JobStatus convert(String source) {
            String value = source.trim();
            return value.isEmpty() ? null : JobStatus.valueOf(value.toUpperCase(Locale.ROOT));
        }
    }
}
