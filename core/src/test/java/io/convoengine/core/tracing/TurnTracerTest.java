/*
 * Copyright 2025 The ConvoEngine Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.convoengine.core.tracing;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.convoengine.core.ConvoException;
import io.convoengine.core.NotFoundException;

/**
 * Unit tests for TurnTracer, run against the no-op global OpenTelemetry.
 */
class TurnTracerTest {

  private final TurnTracer tracer = new TurnTracer();

  @Test
  void testReturnsResult() {
    Map<String, Object> attributes = new HashMap<>();
    attributes.put(TurnTracer.ATTR_CONVERSATION_ID, "t1");
    attributes.put(TurnTracer.ATTR_QUEUED, Boolean.TRUE);
    attributes.put("convo:count", 3);
    attributes.put("convo:nullable", null);

    String result = tracer.inSpan("convo.turn", attributes, () -> "done");

    assertEquals("done", result);
  }

  @Test
  void testNullAttributes() {
    assertEquals(1, tracer.inSpan("convo.turn", null, () -> 1));
  }

  @Test
  void testConvoExceptionPropagatesUnchanged() {
    NotFoundException original = new NotFoundException("t1");

    ConvoException thrown = assertThrows(ConvoException.class, () -> tracer.inSpan("convo.turn", Map.of(), () -> {
      throw original;
    }));

    assertSame(original, thrown);
  }

  @Test
  void testCheckedExceptionIsWrapped() {
    ConvoException thrown = assertThrows(ConvoException.class, () -> tracer.inSpan("convo.turn", Map.of(), () -> {
      throw new IOException("socket closed");
    }));

    assertTrue(thrown.getCause() instanceof IOException);
    assertTrue(thrown.getMessage().contains("convo.turn"));
  }
}
