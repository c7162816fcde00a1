/*
 * Copyright 2021 The Netty Project
 *
 * The Netty Project licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */
package io.netty.image.api;

/**
 * Thrown when a setter on an image buffer, or on one of its metadata objects, receives an out-of-range value.
 * <p>
 * Some setters still change the target field before throwing; a negative width or height is clamped to zero, for
 * instance. Such cases are documented on the setter.
 */
public class InvalidValueException extends IllegalArgumentException {
    private static final long serialVersionUID = -6150871573620465541L;

    public InvalidValueException(String message) {
        super(message);
    }
}
