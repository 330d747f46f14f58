package ch.epfl.vlsc.vhdl.settings;

import com.google.common.collect.ImmutableList;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

public class VhdlSettings {

    static public PathSetting targetPath = new PathSetting() {
        @Override
        public String getKey() {
            return "target-path";
        }

        @Override
        public String getDescription() {
            return "Directory where the generated VHDL file is written.";
        }

        @Override
        public Path defaultValue(Configuration configuration) {
            return Paths.get("");
        }
    };

    static public StringSetting fileExtension = new StringSetting() {
        @Override
        public String getKey() {
            return "file-extension";
        }

        @Override
        public String getDescription() {
            return "Extension appended to the design name to form the output file name.";
        }

        @Override
        public String defaultValue(Configuration configuration) {
            return ".vhd";
        }
    };

    // -- Architecture
    static public StringSetting architectureName = new StringSetting() {
        @Override
        public String getKey() {
            return "architecture-name";
        }

        @Override
        public String getDescription() {
            return "Name of the generated architecture body.";
        }

        @Override
        public String defaultValue(Configuration configuration) {
            return "MyHDL";
        }
    };

    static public IntegerSetting indentationWidth = new IntegerSetting() {
        @Override
        public String getKey() {
            return "indentation-width";
        }

        @Override
        public String getDescription() {
            return "Number of spaces per indentation level.";
        }

        @Override
        public Integer defaultValue(Configuration configuration) {
            return 4;
        }
    };

    // -- Optimizations
    static public OnOffSetting romDefaultLastEntry = new OnOffSetting() {
        @Override
        public String getKey() {
            return "rom-default-last-entry";
        }

        @Override
        public String getDescription() {
            return "In the case statement written for a ROM read, the last entry becomes the others branch. When off, every entry gets its own branch and others does nothing.";
        }

        @Override
        public Boolean defaultValue(Configuration configuration) {
            return true;
        }
    };

    static public OnOffSetting ifToCase = new OnOffSetting() {
        @Override
        public String getKey() {
            return "if-to-case";
        }

        @Override
        public String getDescription() {
            return "Writes an if chain comparing one variable against distinct constants as a case statement.";
        }

        @Override
        public Boolean defaultValue(Configuration configuration) {
            return true;
        }
    };

    static public OnOffSetting checkReservedNames = new OnOffSetting() {
        @Override
        public String getKey() {
            return "check-reserved-names";
        }

        @Override
        public String getDescription() {
            return "Renames internal signals and processes named after VHDL reserved words.";
        }

        @Override
        public Boolean defaultValue(Configuration configuration) {
            return true;
        }
    };

    public static List<Setting<?>> all() {
        return ImmutableList.of(targetPath, fileExtension, architectureName, indentationWidth,
                romDefaultLastEntry, ifToCase, checkReservedNames);
    }
}
