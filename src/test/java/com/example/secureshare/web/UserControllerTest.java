package com.example.secureshare.web;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class UserControllerTest {

    @Test
    void testEscapeLike() {
        assertEquals("bob", UserController.escapeLike("bob"));
        assertEquals("100\\%", UserController.escapeLike("100%"));
        assertEquals("a\\_b", UserController.escapeLike("a_b"));
        assertEquals("c:\\\\dir", UserController.escapeLike("c:\\dir"));
        assertEquals("\\\\\\%", UserController.escapeLike("\\%"));
    }
}
