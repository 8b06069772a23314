package com.unitbench.trace;

import org.testng.annotations.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class StackWalkerCaptureTest {

    @Test
    public void capture_startsAtCaller() {
        List<StackFrame> frames = new StackWalkerCapture().capture();

        assertThat(frames).isNotEmpty();
        StackFrame top = frames.get(0);
        assertThat(top.getClassName()).isEqualTo(StackWalkerCaptureTest.class.getName());
        assertThat(top.getFunction()).isEqualTo("capture_startsAtCaller");
        assertThat(top.getFile()).isEqualTo("StackWalkerCaptureTest.java");
        assertThat(top.getLine()).isPositive();
    }

    @Test
    public void format_namesClassMethodAndLine() {
        StackFrame frame = new StackFrame("testTotal", "OrderTest.java", 12, "com.example.OrderTest");

        assertThat(frame.format()).isEqualTo("com.example.OrderTest.testTotal, line 12");
        assertThat(frame.hasReceiver()).isFalse();
    }
}
