package com.opsbuddy.support;

import com.opsbuddy.exception.GlobalExceptionHandler;
import org.springframework.http.converter.ByteArrayHttpMessageConverter;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * 컨트롤러 단위 테스트용 standalone MockMvc (GlobalExceptionHandler 포함)
 */
public final class MockMvcSupport {

    private MockMvcSupport() {
    }

    public static MockMvc standalone(Object... controllers) {
        return MockMvcBuilders.standaloneSetup(controllers)
                .setControllerAdvice(new GlobalExceptionHandler())
                .setMessageConverters(
                        new ByteArrayHttpMessageConverter(),
                        new StringHttpMessageConverter(),
                        new MappingJackson2HttpMessageConverter(TestFixtures.objectMapper())
                )
                .build();
    }
}
