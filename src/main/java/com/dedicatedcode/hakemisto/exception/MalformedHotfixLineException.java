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

public class MalformedHotfixLineException extends StorageException {

    public MalformedHotfixLineException(String line, String reason) {
        super(line, String.format("malformed hotfix line \"%s\": %s", line, reason));
    }

    public MalformedHotfixLineException(String line, String reason, Throwable cause) {
        super(line, String.format("malformed hotfix line \"%s\": %s", line, reason), cause);
    }
}
