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

package io.convoengine.session.engine;

/**
 * ExecutionEngine creates and tears down engine sessions. It is the only
 * object shared by every conversation, so implementations must support
 * concurrent session creation.
 */
public interface ExecutionEngine {

  /**
   * Creates a new session. The listener is bound for the session's whole
   * lifetime and never replaced.
   *
   * @param config
   *            the session configuration
   * @param listener
   *            receives every event the session emits
   * @return the new session
   * @throws Exception
   *             if the session cannot be created
   */
  EngineSession createSession(SessionConfig config, StreamListener listener) throws Exception;

  /**
   * Resumes a previously created session.
   *
   * @param sessionId
   *            the engine-side id of the session to resume
   * @param config
   *            the session configuration
   * @param listener
   *            receives every event the session emits
   * @return the resumed session
   * @throws Exception
   *             if the session cannot be resumed
   */
  default EngineSession resumeSession(String sessionId, SessionConfig config, StreamListener listener)
      throws Exception {
    throw new UnsupportedOperationException("This engine cannot resume sessions");
  }

  /**
   * Ends a session and releases its resources.
   *
   * @param session
   *            the session to end
   * @throws Exception
   *             if teardown fails
   */
  void endSession(EngineSession session) throws Exception;
}
