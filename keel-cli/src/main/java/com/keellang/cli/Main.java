package com.keellang.cli;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Keel MIR CLI 入口点（picocli）
 */
@Command(name = "keel", version = "Keel MIR v0.1.0",
         mixinStandardHelpOptions = true,
         subcommands = {CompileCommand.class, VerifyCommand.class})
public class Main implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }

    public static void main(String[] args) {
        // 诊断信息含中文，控制台按操作系统原生编码输出
        Charset consoleCharset = consoleCharset();
        PrintStream out = new PrintStream(new FileOutputStream(FileDescriptor.out), true, consoleCharset);
        PrintStream err = new PrintStream(new FileOutputStream(FileDescriptor.err), true, consoleCharset);
        System.setOut(out);
        System.setErr(err);

        CommandLine cmd = new CommandLine(new Main());
        cmd.setOut(new PrintWriter(new OutputStreamWriter(out, consoleCharset), true));
        cmd.setErr(new PrintWriter(new OutputStreamWriter(err, consoleCharset), true));
        System.exit(cmd.execute(args));
    }

    /**
     * 控制台实际使用的字符编码。
     * native.encoding（Java 17+）反映操作系统原生编码，不可用时退回默认编码。
     */
    static Charset consoleCharset() {
        String nativeEnc = System.getProperty("native.encoding");
        if (nativeEnc != null) {
            try {
                if (Charset.isSupported(nativeEnc)) {
                    return Charset.forName(nativeEnc);
                }
            } catch (IllegalCharsetNameException e) {
                return Charset.defaultCharset();
            }
        }
        return Charset.defaultCharset();
    }
}
