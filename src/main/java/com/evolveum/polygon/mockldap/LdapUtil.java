/**
 * Copyright (c) 2015-2026 Evolveum
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
package com.evolveum.polygon.mockldap;

import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import org.apache.directory.api.ldap.model.exception.LdapInvalidDnException;
import org.apache.directory.api.ldap.model.filter.AndNode;
import org.apache.directory.api.ldap.model.filter.ApproximateNode;
import org.apache.directory.api.ldap.model.filter.BranchNode;
import org.apache.directory.api.ldap.model.filter.EqualityNode;
import org.apache.directory.api.ldap.model.filter.ExprNode;
import org.apache.directory.api.ldap.model.filter.ExtensibleNode;
import org.apache.directory.api.ldap.model.filter.FilterParser;
import org.apache.directory.api.ldap.model.filter.GreaterEqNode;
import org.apache.directory.api.ldap.model.filter.LessEqNode;
import org.apache.directory.api.ldap.model.filter.NotNode;
import org.apache.directory.api.ldap.model.filter.OrNode;
import org.apache.directory.api.ldap.model.filter.PresenceNode;
import org.apache.directory.api.ldap.model.filter.SubstringNode;
import org.apache.directory.api.ldap.model.filter.UndefinedNode;

import com.evolveum.polygon.mockldap.dn.DistinguishedName;
import com.evolveum.polygon.mockldap.filter.UnsupportedFilterException;
import com.evolveum.polygon.mockldap.operation.ErrorKind;
import com.evolveum.polygon.mockldap.operation.Outcome;

public class LdapUtil {

    private static final String DN_SPECIAL_CHARS = ",+\"\\<>;=";

    public static byte[] encode(String value) {
        if (value == null) {
            return null;
        }
        return value.getBytes(StandardCharsets.UTF_8);
    }

    public static String decode(byte[] value) {
        if (value == null) {
            return null;
        }
        return new String(value, StandardCharsets.UTF_8);
    }

    public static List<byte[]> encodeAll(String... values) {
        List<byte[]> list = new ArrayList<>(values.length);
        for (String value: values) {
            list.add(encode(value));
        }
        return list;
    }

    public static List<String> decodeAll(List<byte[]> values) {
        List<String> list = new ArrayList<>(values.size());
        for (byte[] value: values) {
            list.add(decode(value));
        }
        return list;
    }

    public static Outcome<DistinguishedName> parseDn(String stringDn) {
        try {
            return Outcome.success(DistinguishedName.parse(stringDn));
        } catch (LdapInvalidDnException e) {
            return Outcome.failure(ErrorKind.INVALID_DN_SYNTAX, "Invalid DN '" + stringDn + "': " + sanitizeString(e.getMessage()));
        }
    }

    /**
     * Parses an RFC 4515 filter string. Only equality, presence and the boolean
     * combinations of those are accepted, any other form anywhere in the tree
     * raises {@link UnsupportedFilterException}.
     */
    public static ExprNode parseSearchFilter(String stringFilter) throws ParseException, UnsupportedFilterException {
        ExprNode filterNode = FilterParser.parse(stringFilter);
        if (filterNode == null || filterNode instanceof UndefinedNode) {
            throw new ParseException("Bad search filter '" + stringFilter + "'", 0);
        }
        checkSupportedFilter(filterNode, stringFilter);
        return filterNode;
    }

    private static void checkSupportedFilter(ExprNode filterNode, String stringFilter) throws UnsupportedFilterException {
        if (filterNode instanceof EqualityNode<?> || filterNode instanceof PresenceNode) {
            return;
        } else if (filterNode instanceof AndNode || filterNode instanceof OrNode || filterNode instanceof NotNode) {
            for (ExprNode subNode : ((BranchNode) filterNode).getChildren()) {
                checkSupportedFilter(subNode, stringFilter);
            }
        } else if (filterNode instanceof SubstringNode) {
            throw new UnsupportedFilterException("Substring filters are not supported: " + stringFilter, stringFilter);
        } else if (filterNode instanceof ApproximateNode<?>) {
            throw new UnsupportedFilterException("Approximate filters are not supported: " + stringFilter, stringFilter);
        } else if (filterNode instanceof GreaterEqNode<?> || filterNode instanceof LessEqNode<?>) {
            throw new UnsupportedFilterException("Ordering filters are not supported: " + stringFilter, stringFilter);
        } else if (filterNode instanceof ExtensibleNode) {
            throw new UnsupportedFilterException("Extensible match filters are not supported: " + stringFilter, stringFilter);
        } else {
            throw new UnsupportedFilterException("Unsupported filter node " + filterNode.getClass().getSimpleName()
                    + ": " + stringFilter, stringFilter);
        }
    }

    /**
     * Normalizes a value argument the way the client API accepts it:
     * null becomes an empty list, a single value is wrapped, a collection is copied.
     * Items are not type-checked here.
     */
    public static List<Object> normalizeValues(Object value) {
        if (value == null) {
            return Collections.emptyList();
        }
        if (value instanceof Collection<?>) {
            return new ArrayList<>((Collection<?>) value);
        }
        if (value instanceof Object[]) {
            return new ArrayList<>(Arrays.asList((Object[]) value));
        }
        return Collections.singletonList(value);
    }

    /**
     * Checks that every item is a byte array and returns private copies of them.
     */
    public static Outcome<List<byte[]>> checkByteValues(String attrName, List<Object> values) {
        List<byte[]> byteValues = new ArrayList<>(values.size());
        for (Object value: values) {
            if (!(value instanceof byte[])) {
                return Outcome.failure(ErrorKind.INVALID_VALUE_TYPE, "Expected a byte array in the values of attribute "
                        + attrName + ", got " + (value == null ? "null" : value.getClass().getName()));
            }
            byteValues.add(((byte[]) value).clone());
        }
        return Outcome.success(byteValues);
    }

    public static boolean containsValue(List<byte[]> values, byte[] value) {
        for (byte[] existing: values) {
            if (Arrays.equals(existing, value)) {
                return true;
            }
        }
        return false;
    }

    public static List<byte[]> copyValues(List<byte[]> values) {
        List<byte[]> copy = new ArrayList<>(values.size());
        for (byte[] value: values) {
            copy.add(value.clone());
        }
        return copy;
    }

    /**
     * Escapes a DN attribute value (RFC 4514, section 2.4).
     */
    public static String escapeDnValue(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (DN_SPECIAL_CHARS.indexOf(c) >= 0
                    || (i == 0 && (c == ' ' || c == '#'))
                    || (i == value.length() - 1 && c == ' ')) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    public static String toShortString(List<byte[]> values) {
        StringBuilder sb = new StringBuilder("[");
        boolean isFirst = true;
        for (byte[] value: values) {
            if (isFirst) {
                isFirst = false;
            } else {
                sb.append(", ");
            }
            if (isPrintable(value)) {
                sb.append(decode(value));
            } else {
                sb.append("0x").append(binaryToHex(value));
            }
        }
        return sb.append(']').toString();
    }

    private static boolean isPrintable(byte[] value) {
        for (byte b: value) {
            if (b < 0x20 || b > 0x7e) {
                return false;
            }
        }
        return true;
    }

    public static String sanitizeString(String in) {
        if (in == null) {
            return null;
        }
        return in.replaceAll("\\p{C}", "?");
    }

    public static String binaryToHex(byte[] bytes) {
        if (bytes == null) {
            return null;
        }
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b & 0xff));
        }
        return sb.toString();
    }

}
