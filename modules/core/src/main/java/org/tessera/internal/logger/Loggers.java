/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.tessera.internal.logger;

/**
 * Factory of {@link TesseraLogger} instances backed by {@link System#getLogger(String)}, which is {@code java.util.logging}
 * unless another {@link System.LoggerFinder} is installed.
 */
public final class Loggers {
    private Loggers() {
    }

    /**
     * Returns a logger named after the class.
     *
     * @param cls Class.
     * @return Logger.
     */
    public static TesseraLogger forClass(Class<?> cls) {
        return new TesseraLoggerImpl(System.getLogger(cls.getName()));
    }
}
