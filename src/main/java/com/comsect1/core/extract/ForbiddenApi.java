package com.comsect1.core.extract;

import java.util.Arrays;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Platform, UI and I/O namespaces and calls an Idea file must not use.
 * <p>
 * Import entries carry one pattern per sub-dialect (VB {@code Imports}, matched
 * case-insensitively, and C# {@code using ...;}); call entries match anywhere on a line.
 */
public enum ForbiddenApi {

    WINFORMS("ida-no-winforms", "System.Windows.Forms (WinForms UI layer)",
            "^\\s*Imports\\s+System\\.Windows\\.Forms", "^\\s*using\\s+System\\.Windows\\.Forms\\s*;"),
    DRAWING("ida-no-drawing", "System.Drawing (Graphics API)",
            "^\\s*Imports\\s+System\\.Drawing(?!\\s*\\.\\s*Color\\b)", "^\\s*using\\s+System\\.Drawing\\s*;"),
    INTEROP("ida-no-interop", "Microsoft.Office.Interop (COM Interop)",
            "^\\s*Imports\\s+Microsoft\\.Office\\.Interop", "^\\s*using\\s+Microsoft\\.Office\\.Interop"),
    SERIAL_PORT("ida-no-serialport", "System.IO.Ports (SerialPort/hardware)",
            "^\\s*Imports\\s+System\\.IO\\.Ports", "^\\s*using\\s+System\\.IO\\.Ports\\s*;"),
    FILE_IO("ida-no-fileio", "System.IO (File I/O)",
            "^\\s*Imports\\s+System\\.IO\\b", "^\\s*using\\s+System\\.IO\\s*;"),

    MESSAGE_BOX("ida-no-messagebox", "MessageBox.Show (UI feedback must stay in prx_/poi_)",
            "\\bMessageBox\\.Show\\s*\\("),
    INVOKE("ida-no-invoke", ".Invoke / .BeginInvoke (UI thread marshal)",
            "\\.(?:Begin)?Invoke\\s*\\("),
    THREAD_SLEEP("ida-no-threadsleep", "Thread.Sleep (blocking delay; use timing abstraction)",
            "\\bThread\\.Sleep\\s*\\("),
    PROCESS_START("ida-no-processstart", "Process.Start (OS shell call)",
            "\\bProcess\\.Start\\s*\\(");

    private final String ruleId;
    private final String description;
    private final Pattern basicImport;
    private final Pattern sharpImport;
    private final Pattern call;

    ForbiddenApi(String ruleId, String description, String basicImport, String sharpImport) {
        this.ruleId = ruleId;
        this.description = description;
        this.basicImport = Pattern.compile(basicImport, Pattern.CASE_INSENSITIVE);
        this.sharpImport = Pattern.compile(sharpImport, Pattern.CASE_INSENSITIVE);
        this.call = null;
    }

    ForbiddenApi(String ruleId, String description, String call) {
        this.ruleId = ruleId;
        this.description = description;
        this.basicImport = null;
        this.sharpImport = null;
        this.call = Pattern.compile(call);
    }

    public String ruleId() {
        return ruleId;
    }

    public boolean isImport() {
        return call == null;
    }

    /**
     * Whether {@code line} uses this API. Import entries pick the VB pattern for
     * {@code .vb} files and the C# pattern otherwise.
     */
    public boolean matches(String line, String extension) {
        if (isImport()) {
            Pattern p = ".vb".equalsIgnoreCase(extension) ? basicImport : sharpImport;
            return p.matcher(line).find();
        }
        return call.matcher(line).find();
    }

    /** Human-readable form used in finding messages. */
    public String describe(String extension) {
        if (!isImport()) {
            return description;
        }
        return (".vb".equalsIgnoreCase(extension) ? "Imports " : "using ") + description;
    }

    public static Optional<ForbiddenApi> byRuleId(String ruleId) {
        return Arrays.stream(values()).filter(api -> api.ruleId.equals(ruleId)).findFirst();
    }
}
