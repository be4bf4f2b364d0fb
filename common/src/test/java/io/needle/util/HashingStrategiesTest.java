/*
 * Copyright 2026 The Needle Project
 *
 * The Needle Project licenses this file to you under the Apache License,
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
package io.needle.util;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class HashingStrategiesTest {

    @Test
    public void testJavaHasher() {
        HashingStrategy<String> strategy = HashingStrategies.javaHasher();

        assertSame(HashingStrategy.JAVA_HASHER, strategy);
        assertTrue(strategy.equals("a", new String("a")));
        assertTrue(strategy.equals(null, null));
        assertFalse(strategy.equals("a", null));
        assertEquals("a".hashCode(), strategy.hashCode("a"));
        assertEquals(0, strategy.hashCode(null));
    }

    @Test
    public void testIdentity() {
        HashingStrategy<String> strategy = HashingStrategies.identity();
        String a = "a";

        assertTrue(strategy.equals(a, a));
        assertFalse(strategy.equals(a, new String(a)));
        assertEquals(System.identityHashCode(a), strategy.hashCode(a));
    }

    @Test
    public void testCaseInsensitiveCharacters() {
        HashingStrategy<Character> strategy = HashingStrategies.caseInsensitiveCharacters();

        assertTrue(strategy.equals('a', 'A'));
        assertEquals(strategy.hashCode('a'), strategy.hashCode('A'));
        assertTrue(strategy.equals('é', 'É'));
        assertFalse(strategy.equals('a', 'b'));
        assertFalse(strategy.equals('a', null));
        assertTrue(strategy.equals(null, null));
        assertEquals(0, strategy.hashCode(null));
    }

    @Test
    public void testSequenceEquality() {
        SequenceHashingStrategy<Character> strategy =
                HashingStrategies.sequence(HashingStrategies.caseInsensitiveCharacters());

        assertTrue(strategy.equals(Arrays.asList('a', 'b'), Arrays.asList('A', 'B')));
        assertEquals(strategy.hashCode(Arrays.asList('a', 'b')), strategy.hashCode(Arrays.asList('A', 'B')));
        assertFalse(strategy.equals(Arrays.asList('a', 'b'), Arrays.asList('a')));
        assertFalse(strategy.equals(Arrays.asList('a', 'b'), Arrays.asList('b', 'a')));
        assertFalse(strategy.equals(Arrays.asList('a'), null));
        assertTrue(strategy.equals(Collections.<Character>emptyList(), new ArrayList<Character>()));
        assertSame(HashingStrategies.caseInsensitiveCharacters(), strategy.elementStrategy());
    }

    @Test
    public void testSequenceHashIsOrderSensitive() {
        SequenceHashingStrategy<Integer> strategy = HashingStrategies.sequence(HashingStrategies.<Integer>javaHasher());
        List<Integer> list = Arrays.asList(1, 2, 3);

        assertEquals(list.hashCode(), strategy.hashCode(list));
        assertNotEquals(strategy.hashCode(list), strategy.hashCode(Arrays.asList(3, 2, 1)));
        assertEquals(0, strategy.hashCode(null));
    }

    @Test
    public void testSequenceOfSubList() {
        SequenceHashingStrategy<Integer> strategy = HashingStrategies.sequence(HashingStrategies.<Integer>javaHasher());
        List<Integer> list = Arrays.asList(1, 2, 3);

        assertTrue(strategy.equals(list.subList(1, 3), Arrays.asList(2, 3)));
        assertEquals(strategy.hashCode(list.subList(1, 3)), strategy.hashCode(Arrays.asList(2, 3)));
    }
}
