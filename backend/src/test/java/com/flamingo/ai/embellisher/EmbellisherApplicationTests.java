package com.flamingo.ai.embellisher;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;

/** Context loading check. Model beans are built from the test key and never called here. */
@SpringBootTest
class EmbellisherApplicationTests {

  @Test
  void contextLoads() {}
}
