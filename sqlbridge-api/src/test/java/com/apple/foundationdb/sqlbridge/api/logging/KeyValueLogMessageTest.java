/*
 * KeyValueLogMessageTest.java
 *
 * This source file is part of the FoundationDB open source project
 *
 * Copyright 2015-2024 Apple Inc. and the FoundationDB project authors
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
 */

package com.apple.foundationdb.sqlbridge.api.logging;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class KeyValueLogMessageTest {

    @Test
    void keysAreSortedAndQuoted() {
        String message = KeyValueLogMessage.of("opened connection",
                LogMessageKeys.POOL_MAX, 16,
                LogMessageKeys.ENDPOINT, "localhost:7777");
        Assertions.assertEquals("opened connection endpoint=\"localhost:7777\" pool_max=\"16\"", message);
    }

    @Test
    void valuesAndKeysAreSanitized() {
        KeyValueLogMessage message = KeyValueLogMessage.build("bad", "a=b", "say \"hi\"");
        message.addKeyAndValue(LogMessageKeys.CORRELATION_ID, null);
        Assertions.assertEquals("say 'hi'", message.getKeyValueMap().get("ab"));
        Assertions.assertEquals("null", message.getKeyValueMap().get("corr_id"));
        Assertions.assertEquals("bad", message.getStaticMessage());
    }

    @Test
    void unevenKeysAndValues() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> KeyValueLogMessage.of("odd", LogMessageKeys.ENDPOINT));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> KeyValueLogMessage.of("null key", null, "value"));
    }
}
