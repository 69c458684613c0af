/*
 *  This file is part of hakemisto.
 *
 *  Hakemisto is free software: you can redistribute it and/or
 *  modify it under the terms of the GNU Affero General Public License
 *  as published by the Free Software Foundation, either version 3 or
 *  any later version.
 *
 *  Hakemisto is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied
 *  warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.
 *  See the GNU Affero General Public License for more details.
 * You should have received a copy of the GNU Affero General Public License
 * along with Hakemisto. If not, see <https://www.gnu.org/licenses/>.
 */

package com.dedicatedcode.hakemisto.exception;

/**
 * Base class of all errors raised by the storage layer. Carries the input that caused the failure.
 */
public class StorageException extends RuntimeException {

    private final String input;

    public StorageException(String input, String message) {
        super(message);
        this.input = input;
    }

    public StorageException(String input, String message, Throwable cause) {
        super(message, cause);
        this.input = input;
    }

    public String getInput() {
        return input;
    }
}
