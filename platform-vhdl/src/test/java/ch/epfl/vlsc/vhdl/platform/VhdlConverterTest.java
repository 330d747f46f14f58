package ch.epfl.vlsc.vhdl.platform;

import ch.epfl.vlsc.vhdl.ir.design.Design;
import ch.epfl.vlsc.vhdl.ir.design.EnumType;
import ch.epfl.vlsc.vhdl.ir.design.Process;
import ch.epfl.vlsc.vhdl.ir.design.ProcessKind;
import ch.epfl.vlsc.vhdl.ir.design.Signal;
import ch.epfl.vlsc.vhdl.reporting.ConversionErrors;
import ch.epfl.vlsc.vhdl.settings.Configuration;
import ch.epfl.vlsc.vhdl.settings.VhdlSettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicBoolean;

import static ch.epfl.vlsc.vhdl.DesignFixtures.assertConversionError;
import static ch.epfl.vlsc.vhdl.DesignFixtures.counter;
import static ch.epfl.vlsc.vhdl.DesignFixtures.normalized;
import static ch.epfl.vlsc.vhdl.DesignFixtures.used;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class VhdlConverterTest {

    @TempDir
    Path directory;

    private Configuration inDirectory() {
        return Configuration.builder().set(VhdlSettings.targetPath, directory).build();
    }

    /**
     * A top level returning its first argument as instance and a fixed design.
     */
    private static class Fixed implements TopLevel<Object> {
        private final Design design;

        Fixed(Design design) {
            this.design = design;
        }

        @Override
        public Object instantiate(Object... args) {
            return args.length == 0 ? null : args[0];
        }

        @Override
        public Design elaborate(Object instance, Object... args) {
            return design;
        }
    }

    @Test
    public void writesTheDesignFile() throws IOException {
        VhdlConverter converter = new VhdlConverter(inDirectory());

        Path file = converter.convert(counter());

        assertEquals(directory.resolve("counter.vhd"), file);
        String text = normalized(new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
        assertEquals(normalized(new VhdlConverter().convertToString(counter())), text);
    }

    @Test
    public void fileExtensionIsConfigurable() {
        Configuration configuration = Configuration.builder()
                .set(VhdlSettings.targetPath, directory)
                .set(VhdlSettings.fileExtension, ".vhdl")
                .build();

        Path file = new VhdlConverter(configuration).convert(counter());

        assertEquals(directory.resolve("counter.vhdl"), file);
        assertTrue(Files.exists(file));
    }

    @Test
    public void failedConversionLeavesNoFile() {
        EnumType state = new EnumType("state", Arrays.asList("IDLE", "RUN"));
        Signal current = used(Signal.enumerated("current", state.getItem("IDLE").get()));
        Design design = Design.builder("fsm").port(current).build();

        assertConversionError(ConversionErrors.UNSUPPORTED_TYPE, () -> new VhdlConverter(inDirectory()).convert(design));
        assertFalse(Files.exists(directory.resolve("fsm.vhd")));
    }

    @Test
    public void signalsAreResetAfterConversion() {
        Design design = counter();
        new VhdlConverter().convertToString(design);

        for (Signal signal : design.getSignals()) {
            assertNull(signal.getName());
            assertFalse(signal.isDriven());
            assertFalse(signal.isRead());
        }
    }

    @Test
    public void signalsAreResetAfterAFailure() {
        Design design = counter();
        Process broken = Process.builder("broken", ProcessKind.SEQUENTIAL)
                .signal(design.getSignals().get(0))
                .build();
        Design failing = design.withProcesses(Arrays.asList(broken));

        assertConversionError(ConversionErrors.STRUCTURE, () -> new VhdlConverter().convertToString(failing));
        for (Signal signal : failing.getSignals()) {
            assertNull(signal.getName());
            assertFalse(signal.isRead());
        }
    }

    @Test
    public void topLevelIsElaboratedAndConverted() {
        VhdlConverter converter = new VhdlConverter(inDirectory());
        Object instance = new Object();

        assertSame(instance, converter.convert(new Fixed(counter()), instance));
        assertTrue(Files.exists(directory.resolve("counter.vhd")));
        assertFalse(converter.isConverting());
    }

    @Test
    public void nestedTopLevelIsOnlyInstantiated() {
        VhdlConverter converter = new VhdlConverter(inDirectory());
        AtomicBoolean converting = new AtomicBoolean();
        Object inner = new Object();
        TopLevel<Object> outer = new TopLevel<Object>() {
            @Override
            public Object instantiate(Object... args) {
                return null;
            }

            @Override
            public Design elaborate(Object instance, Object... args) {
                converting.set(converter.isConverting());
                assertSame(inner, converter.convert(new Fixed(null), inner));
                return counter();
            }
        };

        converter.convert(outer);

        assertTrue(converting.get());
        assertTrue(Files.exists(directory.resolve("counter.vhd")));
    }

    @Test
    public void nestedDesignConversionIsRejected() {
        VhdlConverter converter = new VhdlConverter(inDirectory());
        TopLevel<Object> outer = new Fixed(null) {
            @Override
            public Design elaborate(Object instance, Object... args) {
                converter.convertToString(counter());
                return counter();
            }
        };
        assertConversionError(ConversionErrors.NOT_SUPPORTED, () -> converter.convert(outer));
        assertFalse(converter.isConverting());
    }

    @Test
    public void topLevelIsRequired() {
        VhdlConverter converter = new VhdlConverter(inDirectory());
        assertConversionError(ConversionErrors.FIRST_ARG_TYPE, () -> converter.convert((TopLevel<Object>) null));
        assertConversionError(ConversionErrors.FIRST_ARG_TYPE, () -> converter.convert(new Fixed(null)));
    }

    @Test
    public void callablesAreNotTopLevelProcesses() {
        Process function = Process.builder("f", ProcessKind.FUNCTION).build();
        Design design = Design.builder("top").process(function).build();
        assertConversionError(ConversionErrors.ARG_TYPE, () -> new VhdlConverter().convertToString(design));
    }

    @Test
    public void conversionIsRepeatable() {
        Design design = counter();
        VhdlConverter converter = new VhdlConverter();

        String first = converter.convertToString(design);
        Signal clk = design.getSignals().get(0);
        Signal count = design.getSignals().get(1);
        clk.setRead(true);
        count.setRead(true);
        count.setDriven(true);
        String second = converter.convertToString(design);

        assertEquals(first, second);
    }
}
