package cassia.exec;

import java.util.Map;
import java.util.TreeMap;
import cassia.hir.PrintTools;

/**
* The table of command-line options. Each option carries its kind, its
* current value, the name of its argument and a usage line.
*/
public class CommandLineOptionSet
{
  public static final int UTILITY = 1;
  public static final int TRANSFORM = 2;
  public static final int LIMIT = 3;

  private static class OptionRecord
  {
    public int option_type;
    public String value;
    public String arg;
    public String usage;

    public OptionRecord(int type, String value, String arg, String usage)
    {
      this.option_type = type;
      this.value = value;
      this.arg = arg;
      this.usage = usage;
    }
  }

  private TreeMap<String, OptionRecord> name_to_record;

  public CommandLineOptionSet()
  {
    name_to_record = new TreeMap<String, OptionRecord>();
  }

  public void add(String name, String usage)
  {
    name_to_record.put(name, new OptionRecord(UTILITY, null, null, usage));
  }

  public void add(String name, String arg, String usage)
  {
    name_to_record.put(name, new OptionRecord(UTILITY, null, arg, usage));
  }

  public void add(int type, String name, String usage)
  {
    name_to_record.put(name, new OptionRecord(type, null, null, usage));
  }

  public void add(int type, String name, String arg, String usage)
  {
    name_to_record.put(name, new OptionRecord(type, null, arg, usage));
  }

  public void add(int type, String name, String value, String arg, String usage)
  {
    name_to_record.put(name, new OptionRecord(type, value, arg, usage));
  }

  public boolean contains(String name)
  {
    return name_to_record.containsKey(name);
  }

  /**
  * Returns the usage of every option grouped by kind.
  */
  public String getUsage()
  {
    StringBuilder sb = new StringBuilder(4000);
    appendSection(sb, "UTILITY", UTILITY);
    appendSection(sb, "LIMIT", LIMIT);
    appendSection(sb, "TRANSFORM", TRANSFORM);
    return sb.toString();
  }

  private void appendSection(StringBuilder sb, String title, int type)
  {
    String sep = PrintTools.line_sep;
    for (int i = 0; i < 80; i++) sb.append("-");
    sb.append(sep).append(title).append(sep);
    for (int i = 0; i < 80; i++) sb.append("-");
    sb.append(sep).append(getUsage(type));
  }

  public String getUsage(int type)
  {
    StringBuilder usage = new StringBuilder(1000);
    String sep = PrintTools.line_sep;
    for (Map.Entry<String, OptionRecord> entry : name_to_record.entrySet()) {
      OptionRecord record = entry.getValue();
      if (record.option_type == type) {
        usage.append("-").append(entry.getKey());
        if (record.arg != null) {
          usage.append("=").append(record.arg);
        }
        usage.append(sep).append("    ").append(record.usage);
        if (record.value != null) {
          usage.append(" (default: ").append(record.value).append(")");
        }
        usage.append(sep).append(sep);
      }
    }
    return usage.toString();
  }

  public String getValue(String name)
  {
    OptionRecord record = name_to_record.get(name);
    if (record == null)
      return null;
    else
      return record.value;
  }

  public void setValue(String name, String value)
  {
    OptionRecord record = name_to_record.get(name);
    if (record != null)
      record.value = value;
  }

  public int getType(String name)
  {
    OptionRecord record = name_to_record.get(name);
    if (record == null)
      return 0;
    else
      return record.option_type;
  }

  /** Checks if the option expects an argument. */
  public boolean takesArgument(String name)
  {
    OptionRecord record = name_to_record.get(name);
    return (record != null && record.arg != null);
  }
}
