/*
 * FrameCodec.java
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
import com.google.common.io.ByteStreams;
import com.google.protobuf.CodedInputStream;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.MessageLite;
import com.google.protobuf.Parser;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Reads and writes varint-length-delimited protobuf frames on a byte stream, the framing produced by
 * {@link MessageLite#writeDelimitedTo(OutputStream)}.
 *
 * <p>A codec is not thread safe. Frames written from several threads must be serialized by the caller, and a
 * stream should have exactly one reader.</p>
 */
public final class FrameCodec {
    /**
     * Frames longer than this are rejected as a protocol violation rather than allocated.
     */
    public static final int MAX_FRAME_BYTES = 64 * 1024 * 1024;

    @Nonnull
    private final InputStream in;
    @Nonnull
    private final OutputStream out;
    private final int maxFrameBytes;

    public FrameCodec(@Nonnull InputStream in, @Nonnull OutputStream out) {
        this(in, out, MAX_FRAME_BYTES);
    }

    public FrameCodec(@Nonnull InputStream in, @Nonnull OutputStream out, int maxFrameBytes) {
        this.in = new BufferedInputStream(in);
        this.out = new BufferedOutputStream(out);
        this.maxFrameBytes = maxFrameBytes;
    }

    /**
     * Write one frame and flush it.
     *
     * @param message the message to send
     * @throws IOException if the stream fails
     */
    public void writeFrame(@Nonnull MessageLite message) throws IOException {
        message.writeDelimitedTo(out);
        out.flush();
    }

    /**
     * Read one frame.
     *
     * @param parser parser for the expected message type
     * @param <T> the message type
     * @return the message, or {@code null} if the stream ended cleanly before the next frame
     * @throws IOException if the stream fails or ends in the middle of a frame
     * @throws BridgeException with {@link ErrorCode#PROTOCOL_VIOLATION} if the frame is malformed or too long
     */
    @Nullable
    public <T extends MessageLite> T readFrame(@Nonnull Parser<T> parser) throws IOException, BridgeException {
        final int firstByte = in.read();
        if (firstByte == -1) {
            return null;
        }
        final int length;
        try {
            length = CodedInputStream.readRawVarint32(firstByte, in);
        } catch (InvalidProtocolBufferException e) {
            throw new BridgeException("Malformed frame length", ErrorCode.PROTOCOL_VIOLATION, e);
        }
        if (length < 0 || length > maxFrameBytes) {
            throw new BridgeException("Frame length " + length + " outside of [0, " + maxFrameBytes + "]",
                    ErrorCode.PROTOCOL_VIOLATION);
        }
        final byte[] frame = new byte[length];
        ByteStreams.readFully(in, frame);
        try {
            return parser.parseFrom(frame);
        } catch (InvalidProtocolBufferException e) {
            throw new BridgeException("Malformed frame: " + e.getMessage(), ErrorCode.PROTOCOL_VIOLATION, e);
        }
    }
}
