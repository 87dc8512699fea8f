package com.yourname.codeoptimizer;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class CodeOptimizerApplicationTests {

    @Test
    void contextLoads() {
    }
}
