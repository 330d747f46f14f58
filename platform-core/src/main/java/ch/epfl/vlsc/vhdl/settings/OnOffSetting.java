package ch.epfl.vlsc.vhdl.settings;

import java.util.Optional;

public abstract class OnOffSetting implements Setting<Boolean> {

    @Override
    public Optional<Boolean> read(String string) {
        switch (string.trim().toLowerCase()) {
            case "on":
            case "true":
            case "yes":
                return Optional.of(true);
            case "off":
            case "false":
            case "no":
                return Optional.of(false);
            default:
                return Optional.empty();
        }
    }
}
