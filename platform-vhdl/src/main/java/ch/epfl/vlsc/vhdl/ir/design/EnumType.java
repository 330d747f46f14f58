package ch.epfl.vlsc.vhdl.ir.design;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

/**
 * An enumerated type with an optional per-item encoding.
 */
public class EnumType implements DesignObject {
    private final String name;
    private final ImmutableList<EnumItem> items;
    private final ImmutableList<String> encodings;

    public EnumType(String name, List<String> items) {
        this(name, items, null);
    }

    public EnumType(String name, List<String> items, List<String> encodings) {
        this.name = name;
        ImmutableList.Builder<EnumItem> builder = ImmutableList.builder();
        for (int i = 0; i < items.size(); i++) {
            builder.add(new EnumItem(this, items.get(i), i));
        }
        this.items = builder.build();
        if (encodings != null && encodings.size() != items.size()) {
            throw new IllegalArgumentException("Enumeration " + name + " needs one encoding per item");
        }
        this.encodings = encodings == null ? null : ImmutableList.copyOf(encodings);
    }

    public String getName() {
        return name;
    }

    /**
     * The name of the VHDL type declared for this enumeration.
     */
    public String getTypeName() {
        return "t_enum_" + name;
    }

    public ImmutableList<EnumItem> getItems() {
        return items;
    }

    public Optional<ImmutableList<String>> getEncodings() {
        return Optional.ofNullable(encodings);
    }

    public Optional<EnumItem> getItem(String name) {
        return items.stream().filter(item -> item.getName().equals(name)).findFirst();
    }

    @Override
    public String toString() {
        return getTypeName();
    }
}
