package io.seisgamma.associate;

/*
 * Copyright (c) seisgamma
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

/**
 * Thrown when a mixture parameter array does not have its expected shape.
 */
public class ParameterShapeException extends IllegalArgumentException {

    private final String parameter;

    public ParameterShapeException(String parameter, String expected, String actual) {
        super(String.format("The parameter '%s' should have the shape of %s, but got %s",
            parameter, expected, actual));
        this.parameter = parameter;
    }

    /**
     * Name of the offending parameter.
     */
    public String parameter() {
        return parameter;
    }
}
