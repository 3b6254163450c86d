/*
 * Copyright (c) 2026 MakiBytes.
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
package de.makibytes.trafficlyt.web;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

@DisplayName("Request id and client id Tests")
class RequestTimingFilterTest {

    @Test
    @DisplayName("caller request id is echoed, missing or oversized ids are replaced")
    void requestIdResolution() {
        assertEquals("abc-123", RequestTimingFilter.resolveRequestId(" abc-123 "));

        String generated = RequestTimingFilter.resolveRequestId(null);
        assertEquals(32, generated.length());
        assertTrue(generated.matches("[0-9a-f]{32}"));
        assertNotEquals(generated, RequestTimingFilter.resolveRequestId(""));
        assertEquals(32, RequestTimingFilter.resolveRequestId("x".repeat(200)).length());
    }

    @Test
    @DisplayName("forwarded header is only used when trusted")
    void clientIdResolution() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr("10.0.0.5");
        request.addHeader(ClientIdResolver.FORWARDED_FOR, "203.0.113.7, 10.0.0.1");

        assertEquals("10.0.0.5", new ClientIdResolver(false).resolve(request));
        assertEquals("203.0.113.7", new ClientIdResolver(true).resolve(request));
    }
}
