package FSARegex;

import FSARegex.Synthesis.RegexSynthesizer;
import FSARegex.Validation.FSAValidator;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

class FSARegexCommandLineTest {
  @TempDir
  Path tempDir;

  private Path write(String... lines) throws IOException {
    Path input = tempDir.resolve("input.txt");
    Files.write(input, List.of(lines));
    return input;
  }

  @Test
  void testRegexOutput() throws IOException {
    Path input = write(
        "type=[deterministic]",
        "states=[q0]",
        "alphabet=[a]",
        "initial=[q0]",
        "accepting=[q0]",
        "transitions=[q0>a>q0]");
    Assertions.assertEquals("((a|eps)(a|eps)*(a|eps)|(a|eps))",
        FSARegexCommandLine.convertFile(input.toString(), null));
  }

  @Test
  void testErrorOutput() throws IOException {
    Path input = write(
        "type=[deterministic]",
        "states=[on,off]",
        "alphabet=[turn_on,turn_off]",
        "initial=[off]",
        "accepting=[on]",
        "transitions=[off>turn_on>off,on>turn_off>on,on>turn_on>on]");
    Assertions.assertEquals("E6: Some states are disjoint", FSARegexCommandLine.convertFile(input.toString(), null));
  }

  @Test
  void testMessages() {
    Assertions.assertEquals("E1: Input file is malformed", FSARegexCommandLine.convertLines(List.of(
        "type=[deterministic]", "states=[q0]", "alphabet=[a]", "initial=[q0]", "accepting=[q0]")));
    Assertions.assertEquals("E2: Initial state is not defined", FSARegexCommandLine.convertLines(List.of(
        "type=[deterministic]", "states=[q0]", "alphabet=[a]", "initial=[]", "accepting=[q0]", "transitions=[]")));
    Assertions.assertEquals("E3: Set of accepting states is empty", FSARegexCommandLine.convertLines(List.of(
        "type=[deterministic]", "states=[q0]", "alphabet=[a]", "initial=[q0]", "accepting=[]", "transitions=[]")));
    Assertions.assertEquals("E4: A state 'q3' is not in the set of states", FSARegexCommandLine.convertLines(List.of(
        "type=[deterministic]", "states=[q0,q1]", "alphabet=[a]", "initial=[q0]", "accepting=[q1]",
        "transitions=[q0>a>q3]")));
    Assertions.assertEquals("E5: A transition 'b' is not represented in the alphabet", FSARegexCommandLine.convertLines(List.of(
        "type=[deterministic]", "states=[q0,q1]", "alphabet=[a]", "initial=[q0]", "accepting=[q1]",
        "transitions=[q0>b>q1]")));
    Assertions.assertEquals("E7: FSA is non-deterministic", FSARegexCommandLine.convertLines(List.of(
        "type=[deterministic]", "states=[q0,q1]", "alphabet=[a]", "initial=[q0]", "accepting=[q1]",
        "transitions=[q0>a>q1,q0>a>q0]")));
  }

  @Test
  void testDebugOutputKeepsResult() {
    FSAValidator.DEBUG = true;
    RegexSynthesizer.DEBUG = true;
    try {
      Assertions.assertEquals("((a|eps)(a|eps)*(a|eps)|(a|eps))", FSARegexCommandLine.convertLines(List.of(
          "type=[deterministic]", "states=[q0]", "alphabet=[a]", "initial=[q0]", "accepting=[q0]",
          "transitions=[q0>a>q0]")));
      Assertions.assertEquals("E7: FSA is non-deterministic", FSARegexCommandLine.convertLines(List.of(
          "type=[deterministic]", "states=[q0,q1]", "alphabet=[a]", "initial=[q0]", "accepting=[q0]",
          "transitions=[q0>a>q1,q0>a>q0]")));
    } finally {
      FSAValidator.DEBUG = false;
      RegexSynthesizer.DEBUG = false;
    }
  }

  @Test
  void testTransitionShapes() {
    Assertions.assertEquals("E1: Input file is malformed", FSARegexCommandLine.convertLines(List.of(
        "type=[deterministic]", "states=[q0]", "alphabet=[a]", "initial=[q0]", "accepting=[q0]", "transitions=[]")));
    Assertions.assertEquals("E2: Initial state is not defined", FSARegexCommandLine.convertLines(List.of(
        "type=[deterministic]", "states=[q0,q1]", "alphabet=[a]", "initial=[]", "accepting=[q1]",
        "transitions=[q0>a]")));
    Assertions.assertEquals("E5: A transition 'b' is not represented in the alphabet", FSARegexCommandLine.convertLines(List.of(
        "type=[deterministic]", "states=[q0,q1]", "alphabet=[a]", "initial=[q0]", "accepting=[q1]",
        "transitions=[q0>b>q1,q0>a]")));
  }

  @Test
  void testUnknownTypeIsNonDeterministic() {
    Assertions.assertEquals("((a|eps)(a|eps)*(a|eps)|(a|eps))", FSARegexCommandLine.convertLines(List.of(
        "type=[probabilistic]", "states=[q0]", "alphabet=[a]", "initial=[q0]", "accepting=[q0]",
        "transitions=[q0>a>q0]")));
    // no determinism check without the "deterministic" declaration
    Assertions.assertTrue(FSARegexCommandLine.convertLines(List.of(
        "states=[q0,q1]", "alphabet=[a]", "initial=[q0]", "accepting=[q1]", "transitions=[q0>a>q1,q0>a>q0]",
        "comment=[untyped]")).startsWith("("));
  }

  @Test
  void testMissingFile() {
    Assertions.assertEquals("E1: Input file is malformed",
        FSARegexCommandLine.convertFile(tempDir.resolve("missing.txt").toString(), null));
  }

  @Test
  void testWriteBA() throws IOException {
    Path input = write(
        "type=[non-deterministic]",
        "states=[q0,q1]",
        "alphabet=[a,b]",
        "initial=[q0]",
        "accepting=[q1]",
        "transitions=[q0>a>q1,q0>a>q0,q1>b>q1]");
    Path ba = tempDir.resolve("out.ba");
    String regex = FSARegexCommandLine.convertFile(input.toString(), ba.toString());
    Assertions.assertTrue(regex.startsWith("("), regex);
    Assertions.assertTrue(Files.size(ba) > 0);

    // nothing is written for a rejected FSA
    Path rejected = tempDir.resolve("rejected.ba");
    Files.write(input, List.of(
        "type=[deterministic]", "states=[q0,q1]", "alphabet=[a]", "initial=[q0]", "accepting=[q1]",
        "transitions=[q0>a>q1,q0>a>q0]"));
    FSARegexCommandLine.convertFile(input.toString(), rejected.toString());
    Assertions.assertFalse(Files.exists(rejected));
  }
}
