/*
 * FrameCodecTest.java
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

package com.apple.foundationdb.sqlbridge.protocol;

import com.apple.foundationdb.sqlbridge.api.exceptions.BridgeException;
import com.apple.foundationdb.sqlbridge.api.exceptions.ErrorCode;
import com.apple.foundationdb.sqlbridge.protocol.v1.Request;
import com.google.protobuf.CodedOutputStream;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;

class FrameCodecTest {

    @Test
    void framesArriveInOrderThenEndCleanly() throws Exception {
        ByteArrayOutputStream wire = new ByteArrayOutputStream();
        FrameCodec writer = new FrameCodec(InputStream.nullInputStream(), wire);
        List<Request> sent = List.of(
                BridgeCodec.prepare("insert into test (Title) values (?)").setCorrelationId(1).build(),
                BridgeCodec.status().setCorrelationId(2).build(),
                BridgeCodec.commit(7).setCorrelationId(3).setExecutionTimeoutMillis(1000).build());
        for (Request request : sent) {
            writer.writeFrame(request);
        }

        FrameCodec reader = new FrameCodec(new ByteArrayInputStream(wire.toByteArray()), OutputStream.nullOutputStream());
        for (Request request : sent) {
            Assertions.assertThat(reader.readFrame(Request.parser())).isEqualTo(request);
        }
        Assertions.assertThat(reader.readFrame(Request.parser())).isNull();
    }

    @Test
    void truncatedFrameIsAnIoFailure() throws Exception {
        ByteArrayOutputStream wire = new ByteArrayOutputStream();
        new FrameCodec(InputStream.nullInputStream(), wire).writeFrame(BridgeCodec.prepare("select 1").setCorrelationId(1).build());
        byte[] bytes = wire.toByteArray();
        byte[] truncated = new byte[bytes.length - 2];
        System.arraycopy(bytes, 0, truncated, 0, truncated.length);

        FrameCodec reader = new FrameCodec(new ByteArrayInputStream(truncated), OutputStream.nullOutputStream());
        Assertions.assertThatThrownBy(() -> reader.readFrame(Request.parser())).isInstanceOf(EOFException.class);
    }

    @Test
    void oversizedFrameIsAProtocolViolation() throws Exception {
        ByteArrayOutputStream wire = new ByteArrayOutputStream();
        CodedOutputStream coded = CodedOutputStream.newInstance(wire);
        coded.writeUInt32NoTag(1024);
        coded.flush();

        FrameCodec reader = new FrameCodec(new ByteArrayInputStream(wire.toByteArray()), OutputStream.nullOutputStream(), 16);
        Assertions.assertThatThrownBy(() -> reader.readFrame(Request.parser()))
                .isInstanceOf(BridgeException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.PROTOCOL_VIOLATION);
    }

    @Test
    void garbageIsAProtocolViolation() {
        // length 3, then a field header with the invalid wire type 7
        byte[] garbage = {3, (byte) 0x0F, 1, 2};
        FrameCodec reader = new FrameCodec(new ByteArrayInputStream(garbage), OutputStream.nullOutputStream());
        Assertions.assertThatThrownBy(() -> reader.readFrame(Request.parser()))
                .isInstanceOf(BridgeException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.PROTOCOL_VIOLATION);
    }
}
