package ch.epfl.vlsc.vhdl.settings;

import java.util.Optional;

public abstract class IntegerSetting implements Setting<Integer> {

    @Override
    public Optional<Integer> read(String string) {
        try {
            return Optional.of(Integer.parseInt(string.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
