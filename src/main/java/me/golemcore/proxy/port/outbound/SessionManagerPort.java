package me.golemcore.proxy.port.outbound;


/*
 * Copyright 2026 Aleksei Kuleshov
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
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.proxy.domain.model.StartSessionRequest;

/**
 * External component that provisions agent sessions.
 *
 * <p>
 * A start may be repeated for the same logical trigger around a leadership
 * handover, so implementations must tolerate duplicates.
 */
public interface SessionManagerPort {

    /**
     * Start one session.
     *
     * @return the id of the started session
     * @throws me.golemcore.proxy.domain.exception.SessionStartException
     *             if the session could not be started
     */
    String startSession(StartSessionRequest request);
}
