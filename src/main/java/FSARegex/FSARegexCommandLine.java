package FSARegex;

import FSARegex.Model.ErrorCode;
import FSARegex.Model.FSA;
import FSARegex.Model.ValidationError;
import FSARegex.Synthesis.RegexSynthesizer;
import FSARegex.Validation.FSAValidator;
import FSARegex.Validation.Verdict;
import net.automatalib.exception.FormatException;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;

public class FSARegexCommandLine {
  public static final String DEFAULT_INPUT = "input.txt";

  public static void main(String[] args) {
    String baFilename = null;
    List<String> positional = new ArrayList<>(1);

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--debug".equalsIgnoreCase(arg)) {
        FSAValidator.DEBUG = true;
        RegexSynthesizer.DEBUG = true;
      } else if ("--writeBA".equalsIgnoreCase(arg)) {
        if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
          System.err.println("Missing value for --writeBA");
          printUsageAndExit(); // exits
        }
        baFilename = args[++i];
      } else if (arg.startsWith("-")) {
        printUsageAndExit();
      } else {
        positional.add(arg);
      }
    }

    if (positional.size() > 1) {
      printUsageAndExit();
    }
    String filePath = positional.isEmpty() ? DEFAULT_INPUT : positional.get(0);

    System.out.println(convertFile(filePath, baFilename));
  }

  private static void printUsageAndExit() {
    System.out.println("FSARegex [--debug] [--writeBA <BA output file>] [<FSA input file>]");
    System.out.println("[--debug] : Additional debug/progress output");
    System.out.println("[--writeBA <BA output file>] : Write the validated FSA to specified output file");
    System.out.println();
    System.out.println("<FSA input file> : six-line FSA description, default " + DEFAULT_INPUT);
    System.out.println("  type=[deterministic|non-deterministic]");
    System.out.println("  states=[q0,q1,...]");
    System.out.println("  alphabet=[a,b,...]");
    System.out.println("  initial=[q0]");
    System.out.println("  accepting=[q1,...]");
    System.out.println("  transitions=[q0>a>q1,...]");
    System.exit(0);
  }

  /**
   * Read, validate and convert an FSA file.
   * @param filePath - FSA input file
   * @param baFilename - where to write the validated FSA in BA format, or null
   * @return the regular expression, or the message of the first validation error
   */
  static String convertFile(String filePath, String baFilename) {
    final FSA fsa;
    try {
      fsa = FSAFormat.getFSAFile(filePath);
    } catch (FormatException e) {
      return malformed(e);
    } catch (IOException e) {
      return malformed(e);
    }
    return convert(fsa, baFilename);
  }

  /**
   * Same as {@link #convertFile(String, String)}, for an FSA record already split into lines.
   */
  static String convertLines(List<String> lines) {
    try {
      return convert(FSAFormat.parse(lines), null);
    } catch (FormatException e) {
      return malformed(e);
    }
  }

  private static String convert(FSA fsa, String baFilename) {
    long before = System.currentTimeMillis();
    Verdict verdict = FSAValidator.run(fsa);
    long after = System.currentTimeMillis();
    if (FSAValidator.DEBUG) {
      System.out.println("DEBUG: validation duration: " + ((after - before) / 1000f) + "s");
    }
    if (!verdict.isValid()) {
      return verdict.error().message();
    }
    if (baFilename != null) {
      writeBAFile(baFilename, verdict.fsa());
    }
    return verdict.synthesize();
  }

  private static String malformed(Exception e) {
    if (FSAValidator.DEBUG) {
      System.out.println("DEBUG: Unreadable input: " + e.getMessage());
    }
    return ValidationError.of(ErrorCode.MALFORMED).message();
  }

  private static void writeBAFile(String filename, FSA fsa) {
    if (FSAValidator.DEBUG) {
      System.out.println("DEBUG: Writing to file: " + filename);
    }
    try (OutputStream os = new FileOutputStream(filename)) {
      FSAAutomata.writeBA(os, fsa);
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
  }
}
