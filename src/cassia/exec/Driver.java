package cassia.exec;

import antlr.ANTLRException;
import cassia.base.grammars.ParsedStatement;
import cassia.hir.Environment;
import cassia.hir.Expression;
import cassia.hir.ExpressionTooComplexException;
import cassia.hir.PrintTools;
import cassia.hir.Symbolic;
import cassia.hir.Tools;
import cassia.hir.Variable;
import cassia.transforms.AlgebraicExpansion;
import cassia.transforms.Differentiation;
import cassia.transforms.Evaluation;
import cassia.transforms.Integration;
import cassia.transforms.TrigSimplification;

import java.io.*;
import java.util.ArrayList;
import java.util.List;

/**
 * Implements the command line parser and the statement loop.
 * The driver reads one statement per line from the files named on the
 * command line, or from standard input when there are none. Definitions
 * extend the environment of the session; every other statement is
 * evaluated, transformed by the selected option and printed.
 */
public class Driver
{
  /**
   * A mapping from option names to option values.
   */
  protected static CommandLineOptionSet options = new CommandLineOptionSet();

  static
  {
    registerOptions();
  }

  /** The definitions made so far. */
  protected Environment environment;

  /** The filenames supplied on the command line. */
  protected List<String> filenames;

  /**
   * Constructor used by derived classes.
   */
  protected Driver()
  {
    environment = Environment.empty();
    filenames = new ArrayList<String>();
  }

  /**
   * Registers the legal set of options with their default values. Calling
   * it again restores the defaults.
   */
  public static void registerOptions()
  {
    options.add(options.UTILITY, "help",
                "Print this message");
    options.add(options.UTILITY, "version",
                "Print the version information");
    options.add(options.UTILITY, "verbosity", "0", "N",
                "Degree of status messages (0-4) that you wish to see (default is 0)");
    options.add(options.LIMIT, "max-depth",
                String.valueOf(Symbolic.DEFAULT_MAX_DEPTH), "N",
                "Nesting limit of one simplification or evaluation");
    options.add(options.LIMIT, "integration-budget",
                String.valueOf(Integration.DEFAULT_BUDGET), "N",
                "Number of attempts one integration may make");
    options.add(options.TRANSFORM, "derive", "var",
                "Print the derivative of each expression with respect to var");
    options.add(options.TRANSFORM, "integrate", "var",
                "Print an antiderivative of each expression with respect to var");
    options.add(options.TRANSFORM, "expand",
                "Print the algebraic expansion of each expression");
    options.add(options.TRANSFORM, "trig-simplify",
                "Print the trigonometric normal form of each expression");
  }

  /**
   * Returns the value of the given key or null
   * if the value is not set.  Key values are
   * set on the command line as <b>-option_name=value</b>.
   *
   * @param key The key to search
   * @return the value of the given key or null if the
   *   value is not set.
   */
  public static String getOptionValue(String key)
  {
    return options.getValue(key);
  }

  /**
   * Sets the value of the option represented by the given key.
   *
   * @param key The option name.
   * @param value The option value.
   */
  public static void setOptionValue(String key, String value)
  {
    options.setValue(key, value);
  }

  protected void parseOption(String opt)
  {
    opt = opt.trim();
    if (opt.length() == 0)
      return;
    int eq = opt.indexOf('=');

    // if value is not set
    if (eq == -1)
    {
      if (!options.contains(opt))
        System.err.println("ignoring unrecognized option " + opt);
      else if (options.takesArgument(opt))
        System.err.println("option " + opt + " requires a value");
      else
        setOptionValue(opt, "1");
    }
    // if value is set
    else
    {
      String option_name = opt.substring(0, eq);
      if (options.contains(option_name))
        setOptionValue(option_name, opt.substring(eq + 1));
      else
        System.err.println("ignoring unrecognized option " + option_name);
    }
  }

  /**
   * Parses command line options to Cassia.
   *
   * @param args The String array passed to main by the system.
   */
  protected void parseCommandLine(String[] args)
  {
    int i; /* used after loop; don't put inside for loop */
    for (i = 0; i < args.length; ++i)
    {
      String opt = args[i];
      // options start with "-"
      if (opt.length() < 2 || opt.charAt(0) != '-')
        /* not an option -- skip to handling filenames */
        break;
      parseOption(opt.substring(1));
    }

    if (getOptionValue("help") != null)
    {
      printUsage();
      Tools.exit(0);
    }

    if (getOptionValue("version") != null)
    {
      printVersion();
      Tools.exit(0);
    }

    int transforms = 0;
    for (String name : new String[] {"derive", "integrate", "expand", "trig-simplify"})
      if (getOptionValue(name) != null)
        transforms++;
    if (transforms > 1)
    {
      System.err.println("at most one of -derive, -integrate, -expand and -trig-simplify may be given");
      Tools.exit(1);
    }

    /* the remaining arguments are input files */
    for (; i < args.length; ++i)
      filenames.add(args[i]);
  }

  /**
   * Prints the list of options that Cassia accepts.
   */
  public void printUsage()
  {
    String usage = "\ncassia.exec.Driver [option]... [file]...\n";
    usage += options.getUsage();
    System.err.println(usage);
  }

  /**
   * Prints the version information.
   */
  public void printVersion()
  {
    System.err.println("Cassia 1.0 - A Symbolic Algebra Kernel");
  }

  /**
   * Runs this driver with args as the command line.
   *
   * @param args The command line from main.
   */
  public void run(String[] args)
  {
    parseCommandLine(args);

    PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out));
    try {
      if (filenames.isEmpty())
      {
        PrintTools.printlnStatus("Reading standard input...", 1);
        process(new BufferedReader(new InputStreamReader(System.in)), "<stdin>", out);
      }
      else
      {
        for (String file : filenames)
        {
          PrintTools.printlnStatus(1, "Reading", file + "...");
          BufferedReader in = null;
          try {
            in = new BufferedReader(new FileReader(file));
          } catch (FileNotFoundException e) {
            out.flush();
            Tools.exit("cannot open input file " + file);
            return;
          }
          try {
            process(in, file, out);
          } finally {
            in.close();
          }
        }
      }
    } catch (IOException e) {
      out.flush();
      Tools.exit("I/O error reading input: " + e.getMessage());
      return;
    }
    out.flush();
  }

  /**
   * Executes every statement of the input and prints the results. Blank
   * lines and lines starting with '#' are skipped. A statement that fails
   * is reported on standard error together with its position, and the
   * loop continues with the next line.
   *
   * @param in the input.
   * @param source the name of the input used in messages.
   * @param out the destination of the results.
   * @return the number of statements that failed.
   * @throws IOException if reading the input fails.
   */
  public int process(BufferedReader in, String source, PrintWriter out)
      throws IOException
  {
    int errors = 0;
    int line_number = 0;
    String line;
    while ((line = in.readLine()) != null)
    {
      line_number++;
      String text = line.trim();
      if (text.length() == 0 || text.charAt(0) == '#')
        continue;
      try {
        out.println(execute(text, source));
      } catch (ANTLRException e) {
        System.err.println(source + ":" + line_number + ": syntax error: " + e.getMessage());
        errors++;
      } catch (IllegalArgumentException e) {
        System.err.println(source + ":" + line_number + ": " + e.getMessage());
        errors++;
      } catch (ExpressionTooComplexException e) {
        System.err.println(source + ":" + line_number + ": " + e.getMessage());
        errors++;
      }
    }
    out.flush();
    return errors;
  }

  /**
   * Executes one statement in the environment of this driver.
   *
   * @param text the statement.
   * @param source the name reported in syntax errors, or null.
   * @return the printed result.
   * @throws ANTLRException if the statement does not parse.
   */
  public String execute(String text, String source) throws ANTLRException
  {
    ParsedStatement stmt = Parser.parseStatement(text,
        environment.getFunctionNames(), source);
    String name = stmt.getName();
    switch (stmt.getKind())
    {
      case ParsedStatement.VARIABLE_DEFINITION:
      {
        Expression value = Evaluation.evaluate(stmt.getExpression(), environment);
        environment = environment.define(name, value);
        PrintTools.printlnStatus(1, "defined", name);
        return name + " = " + value;
      }
      case ParsedStatement.FUNCTION_DEFINITION:
      {
        Expression body = Symbolic.simplify(stmt.getExpression());
        environment = environment.defineFunction(name, stmt.getParameters(), body);
        PrintTools.printlnStatus(1, "defined function", name);
        return environment.lookupFunction(name) + " = " + body;
      }
      default:
        return transform(Evaluation.evaluate(stmt.getExpression(), environment));
    }
  }

  /** Returns the environment of the session. */
  public Environment getEnvironment()
  {
    return environment;
  }

  // Applies the transform selected on the command line.
  private String transform(Expression value) throws ANTLRException
  {
    String var = getOptionValue("derive");
    if (var != null)
      return Differentiation.derivative(value, parseVariable(var)).toString();
    var = getOptionValue("integrate");
    if (var != null)
      return Integration.integrate(value, parseVariable(var)).toString();
    if (getOptionValue("expand") != null)
      return AlgebraicExpansion.expand(value).toString();
    if (getOptionValue("trig-simplify") != null)
      return TrigSimplification.simplify(value).toString();
    return value.toString();
  }

  // The variable named by an option value.
  private static Variable parseVariable(String text) throws ANTLRException
  {
    Expression e = Parser.parse(text);
    if (!(e instanceof Variable))
      throw new IllegalArgumentException(text + " is not a variable");
    return (Variable)e;
  }

  /**
   * Entry point for Cassia; creates a new Driver object,
   * and calls run on it with args.
   *
   * @param args Command line options.
   */
  public static void main(String[] args)
  {
    (new Driver()).run(args);
  }
}
