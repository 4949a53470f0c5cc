/*
 * Copyright 2025 AxonOps
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

package com.axonops.perfcounter.jni;

import com.sun.jna.Library;
import com.sun.jna.NativeLong;

/**
 * JNA binding for the parts of the C library the procfs provider needs.
 *
 * <p><b>Internal API:</b> Not part of public API contract. Use {@link Sysconf}.
 */
public interface LibC extends Library {

    /** {@code _SC_CLK_TCK} on Linux: scheduler clock ticks per second. */
    int SC_CLK_TCK = 2;

    /** {@code _SC_PAGESIZE} on Linux: bytes per memory page. */
    int SC_PAGESIZE = 30;

    NativeLong sysconf(int name);
}
