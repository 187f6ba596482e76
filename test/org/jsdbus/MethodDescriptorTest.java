/*
 * Copyright 2009-2011, Qualcomm Innovation Center, Inc.
 *
 *    Licensed under the Apache License, Version 2.0 (the "License");
 *    you may not use this file except in compliance with the License.
 *    You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 *    Unless required by applicable law or agreed to in writing, software
 *    distributed under the License is distributed on an "AS IS" BASIS,
 *    WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *    See the License for the specific language governing permissions and
 *    limitations under the License.
 */

package org.jsdbus;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;

import junit.framework.TestCase;

public class MethodDescriptorTest extends TestCase {
    public MethodDescriptorTest(String name) {
        super(name);
    }

    private MethodDescriptor sum;

    @Override
    public void setUp() throws Exception {
        sum = (MethodDescriptor) InterfaceRegistry.describe(ExampleInterface.class).getMember("sum");
    }

    private static Map<String, Object> keywords(Object... pairs) {
        Map<String, Object> map = new HashMap<String, Object>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put((String) pairs[i], pairs[i + 1]);
        }
        return map;
    }

    private void assertArgumentError(Object[] args, Map<String, Object> keywordArgs) {
        boolean thrown = false;
        try {
            sum.rebuildArgs(args, keywordArgs);
        } catch (ArgumentBusException ex) {
            thrown = true;
        } finally {
            assertTrue(thrown);
        }
    }

    public void testDescriptor() {
        assertEquals("Sum", sum.getName());
        assertEquals("iiii", sum.getInputSignature());
        assertEquals("i", sum.getResultSignature());
        assertEquals(Arrays.asList("a", "b", "c", "d"), sum.getArgsNames());
        assertEquals(4, sum.getArgsCount());
        assertEquals(2, sum.getDefaultArgsStartAt());
    }

    public void testParameterNamesAreDefaultArgNames() throws Exception {
        MethodDescriptor upper =
            (MethodDescriptor) InterfaceRegistry.describe(ExampleInterface.class).getMember("upper");
        assertEquals(Arrays.asList("value"), upper.getArgsNames());
        assertEquals(1, upper.getDefaultArgsStartAt());
    }

    public void testResultArgsNames() throws Exception {
        MethodDescriptor pair =
            (MethodDescriptor) InterfaceRegistry.describe(ExampleInterface.class).getMember("pair");
        assertEquals(Arrays.asList("label", "count"), pair.getResultArgsNames());
        assertEquals(0, pair.getArgsCount());
    }

    public void testDefaultsFillTrailingArguments() throws Exception {
        Object[] args = sum.rebuildArgs(new Object[] { 10, 20 }, Collections.<String, Object>emptyMap());
        assertTrue(Arrays.equals(new Object[] { 10, 20, 1, 2 }, args));
    }

    public void testKeywordArguments() throws Exception {
        Object[] args = sum.rebuildArgs(new Object[] { 10 }, keywords("b", 5));
        assertTrue(Arrays.equals(new Object[] { 10, 5, 1, 2 }, args));

        args = sum.rebuildArgs(new Object[] { 10, 20 }, keywords("d", 7));
        assertTrue(Arrays.equals(new Object[] { 10, 20, 1, 7 }, args));

        args = sum.rebuildArgs(new Object[0], keywords("a", 1, "b", 2, "c", 3, "d", 4));
        assertTrue(Arrays.equals(new Object[] { 1, 2, 3, 4 }, args));
    }

    public void testNullPositionalArgumentIsKept() throws Exception {
        Object[] args = sum.rebuildArgs(new Object[] { 10, 20, null }, Collections.<String, Object>emptyMap());
        assertTrue(Arrays.equals(new Object[] { 10, 20, null, 2 }, args));
    }

    public void testMissingArgumentWithoutDefault() {
        assertArgumentError(new Object[] { 10 }, keywords("c", 99));
        assertArgumentError(new Object[0], Collections.<String, Object>emptyMap());
    }

    public void testTooManyArguments() {
        assertArgumentError(new Object[] { 1, 2, 3, 4, 5 }, Collections.<String, Object>emptyMap());
    }

    public void testUnknownKeyword() {
        assertArgumentError(new Object[] { 1, 2 }, keywords("e", 5));
    }

    public void testKeywordRepeatsPositional() {
        assertArgumentError(new Object[] { 1, 2 }, keywords("a", 5));
    }

    public void testInvokeLocal() throws Exception {
        ExampleInterface obj = new ExampleInterface();
        assertEquals(33, sum.invokeLocal(obj, new Object[] { 10, 20, 1, 2 }).get());
        assertEquals(12, ((MethodDescriptor) obj.getDescription().getMember("twice"))
                     .invokeLocal(obj, new Object[] { 6 }).get());
    }

    public void testInvokeLocalFailure() throws Exception {
        ExampleInterface obj = new ExampleInterface();
        MethodDescriptor refuse = (MethodDescriptor) obj.getDescription().getMember("fail");
        try {
            refuse.invokeLocal(obj, new Object[] { "no" }).join();
            fail("expected failure");
        } catch (CompletionException ex) {
            assertTrue(ex.getCause() instanceof ErrorReplyBusException);
        }
    }

    public void testWrongArgumentTypeIsMarshalError() throws Exception {
        ExampleInterface obj = new ExampleInterface();
        try {
            sum.invokeLocal(obj, new Object[] { "x", 20, 1, 2 }).join();
            fail("expected failure");
        } catch (CompletionException ex) {
            assertTrue(ex.getCause().toString(), ex.getCause() instanceof MarshalBusException);
        }
    }
}
