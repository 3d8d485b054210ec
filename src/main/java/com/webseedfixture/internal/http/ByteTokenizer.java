/*
 * Copyright 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.webseedfixture.internal.http;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import java.nio.ByteBuffer;
import java.util.Arrays;

import static java.util.Objects.requireNonNull;

/**
 * ByteTokenizer is an expandable, first-in first-out byte array that supports tokenization.
 * Bytes are added at the tail and tokenization occurs at the head.
 */
@NotThreadSafe
class ByteTokenizer {
	private static final byte LF = '\n';
	private static final byte CR = '\r';

	@Nonnull
	private byte[] array = new byte[0];
	private int position;
	private int size;
	// Bytes before this offset are known to contain no LF
	private int scanPosition;

	int size() {
		return size;
	}

	int remaining() {
		return size - position;
	}

	void add(@Nonnull ByteBuffer buffer) {
		requireNonNull(buffer);

		int bufferLength = buffer.remaining();

		if (array.length - size < bufferLength)
			array = Arrays.copyOf(array, Math.max(size + bufferLength, array.length * 2));

		buffer.get(array, size, bufferLength);
		size += bufferLength;
	}

	/**
	 * Takes the next line off the head, without its {@code LF} or {@code CRLF} terminator.
	 *
	 * @return the line, or {@code null} if no complete line has arrived yet
	 */
	@Nullable
	byte[] nextLine() {
		int index = -1;

		for (int i = Math.max(position, scanPosition); i < size; i++) {
			if (array[i] == LF) {
				index = i;
				break;
			}
		}

		if (index < 0) {
			scanPosition = size;
			return null;
		}

		int end = index > position && array[index - 1] == CR ? index - 1 : index;
		byte[] result = Arrays.copyOfRange(array, position, end);
		position = index + 1;
		scanPosition = position;
		return result;
	}

	@Nullable
	byte[] next(int length) {
		if (size - position < length)
			return null;

		byte[] result = Arrays.copyOfRange(array, position, position + length);
		position += length;
		scanPosition = position;
		return result;
	}
}
