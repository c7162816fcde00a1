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
 * Thrown when an image buffer is requested with a width or height that is not positive, or with a bit depth that is
 * not one of 1, 2, 4, 8, 16, 24 or 32.
 */
public class InvalidGeometryException extends IllegalArgumentException {
    private static final long serialVersionUID = 2981749256823416607L;

    public InvalidGeometryException(String message) {
        super(message);
    }
}
