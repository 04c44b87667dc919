package com.cliffc.lc;

import org.junit.Test;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

// Runs every program under src/test/resources/lc.  The first line is the
// program; a "// Eval: " line gives the expected normal form, or the name of
// the expected error.
public class TestPrograms {
  @Test public void testAll() throws IOException {
    File folder = new File("src/test/resources/lc");
    File[] tests = folder.listFiles(file -> file.getName().endsWith(".lc"));
    assertTrue(tests!=null && tests.length>0);
    Arrays.sort(tests);
    for( File f : tests ) {
      String src = Files.readString(f.toPath());
      String prog = src.substring(0,src.indexOf('\n'));
      String exeval = get_expected(src,"// Eval: ");
      String rez;
      try {
        rez = new Reduce(10000).reduce(Parse.parse(prog)).toString();
      } catch( SyntaxErr se ) {
        rez = "SyntaxErr: "+se._msg;
      } catch( StepLimit sl ) {
        rez = "StepLimit";
      }
      assertEquals(f.toString(),exeval,rez);
    }
  }

  private static String get_expected(String prog, String marker) {
    int idx = prog.indexOf(marker);
    if( idx == -1 )
      throw new RuntimeException("Test file lacks a "+marker+" comment");
    int eol = prog.indexOf('\n', idx+1);
    return prog.substring(idx+marker.length(),eol).trim();
  }
}
