package org.jenkinsci.pipes.launcher;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.OptionDef;
import org.kohsuke.args4j.spi.OptionHandler;
import org.kohsuke.args4j.spi.Parameters;
import org.kohsuke.args4j.spi.Setter;

/**
 * Parses a strictly positive integer, such as a pipe count or a capacity in bytes.
 */
public class PositiveIntOptionHandler extends OptionHandler<Integer> {
    public PositiveIntOptionHandler(CmdLineParser parser, OptionDef option, Setter<? super Integer> setter) {
        super(parser, option, setter);
    }

    @Override
    public int parseArguments(Parameters params) throws CmdLineException {
        String param = params.getParameter(0);
        int value;
        try {
            value = Integer.parseInt(param.trim());
        } catch (NumberFormatException e) {
            throw new CmdLineException(owner, option.toString() + " takes an integer, not \"" + param + "\"", e);
        }
        if (value <= 0) {
            throw new CmdLineException(owner, option.toString() + " takes a strictly positive number");
        }
        setter.addValue(value);
        return 1;
    }

    @Override
    public String getDefaultMetaVariable() {
        return "N";
    }

    @Override
    protected String print(Integer v) {
        return v == null ? null : Integer.toString(v);
    }
}
