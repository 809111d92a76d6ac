package WFST;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;

public class SymbolTableTest {
  @Test
  void testAddAndFind() {
    final SymbolTable syms = new SymbolTable("letters");
    Assertions.assertEquals(0, syms.addSymbol("<eps>"));
    Assertions.assertEquals(1, syms.addSymbol("a"));
    Assertions.assertEquals(1, syms.addSymbol("a"));
    Assertions.assertEquals(10, syms.addSymbol("z", 10));
    Assertions.assertEquals(11, syms.availableKey());
    Assertions.assertEquals(11, syms.addSymbol("b"));
    // existing key wins
    Assertions.assertEquals(1, syms.addSymbol("a", 20));

    Assertions.assertEquals(4, syms.numSymbols());
    Assertions.assertEquals(10, syms.find("z"));
    Assertions.assertEquals("b", syms.find(11));
    Assertions.assertEquals(SymbolTable.NO_SYMBOL, syms.find("q"));
    Assertions.assertNull(syms.find(5));
    Assertions.assertTrue(syms.member(0));
    Assertions.assertTrue(syms.member("z"));
    Assertions.assertFalse(syms.member(20));
  }

  @Test
  void testCopyIsIndependent() {
    final SymbolTable syms = new SymbolTable("in");
    syms.addSymbol("a");
    final SymbolTable copy = syms.copy();
    Assertions.assertEquals(syms, copy);
    Assertions.assertEquals(syms.hashCode(), copy.hashCode());
    copy.addSymbol("b");
    Assertions.assertNotEquals(syms, copy);
    Assertions.assertFalse(syms.member("b"));
  }

  @Test
  void testBinary() throws IOException {
    final SymbolTable syms = new SymbolTable("words");
    syms.addSymbol("<eps>");
    syms.addSymbol("hello");
    syms.addSymbol("wörld", 7);
    final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    syms.write(new DataOutputStream(bytes));

    final SymbolTable read = SymbolTable.read(new DataInputStream(new ByteArrayInputStream(bytes.toByteArray())), "test");
    Assertions.assertEquals(syms, read);
    Assertions.assertEquals("words", read.getName());
    Assertions.assertEquals(8, read.availableKey());
    Assertions.assertEquals(7, read.find("wörld"));
  }

  @Test
  void testBadMagic() throws IOException {
    final byte[] bytes = {0, 0, 0, 1, 0, 0, 0, 0};
    Assertions.assertNull(SymbolTable.read(new DataInputStream(new ByteArrayInputStream(bytes)), "garbage"));
  }
}
