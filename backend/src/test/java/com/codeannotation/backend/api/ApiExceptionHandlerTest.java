package com.codeannotation.backend.api;

import com.codeannotation.backend.api.response.ErrorKind;
import com.codeannotation.backend.config.JacksonConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class ApiExceptionHandlerTest {

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        mvc = MockMvcBuilders.standaloneSetup(new FailingController())
                .setControllerAdvice(new ApiExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(new JacksonConfig().objectMapper()))
                .build();
    }

    @Test
    void apiExceptionKeepsItsStatus() throws Exception {
        mvc.perform(get("/failing/internal"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.status").value(500))
                .andExpect(jsonPath("$.errors[0].title").value("error counting assignments"));
    }

    @Test
    void unexpectedExceptionIsAGenericInternalError() throws Exception {
        mvc.perform(get("/failing/unexpected"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.errors[0].status").value(500))
                .andExpect(jsonPath("$.errors[0].title").value("Internal Server Error"))
                .andExpect(jsonPath("$.data").doesNotExist());
    }

    @Test
    void unsupportedMethodKeepsSpringStatus() throws Exception {
        mvc.perform(post("/failing/unexpected"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.errors[0].title").value("Method Not Allowed"));
    }

    @RestController
    static class FailingController {

        @GetMapping("/failing/internal")
        public void internal() {
            throw ErrorKind.INTERNAL.wrap("error counting assignments", new IllegalStateException("pool exhausted"));
        }

        @GetMapping("/failing/unexpected")
        public void unexpected() {
            throw new IllegalStateException("boom");
        }
    }
}
