package com.platform.clusterchaos.workload;

import com.platform.clusterchaos.model.RangeFlag;
import com.platform.clusterchaos.model.Workload;
import com.platform.clusterchaos.model.WorkloadOperation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Command-line arguments for the workload generator, in the order the generator's
 * scripts have always passed them:
 * {@code -b op -c count -l payload -h host (-f|-s) first -t threads --mode mode -k keysize -p port [--user u --password pw]}.
 */
public final class DriverArguments {

    private static final String MASK = "******";

    private final List<String> arguments;
    private final int passwordIndex;

    private DriverArguments(List<String> arguments, int passwordIndex) {
        this.arguments = Collections.unmodifiableList(arguments);
        this.passwordIndex = passwordIndex;
    }

    public static DriverArguments forWorkload(Workload workload) {
        List<String> args = new ArrayList<>();
        add(args, "-b", workload.operation().behaviour());
        add(args, "-c", String.valueOf(workload.count()));
        add(args, "-l", String.valueOf(workload.payloadBytes()));
        add(args, "-h", workload.host());
        add(args, rangeFlag(workload).flag(), String.valueOf(workload.first()));
        add(args, "-t", String.valueOf(workload.threads()));
        add(args, "--mode", workload.mode().cliValue());
        add(args, "-k", String.valueOf(workload.keySize()));
        add(args, "-p", String.valueOf(workload.port()));

        int passwordIndex = -1;
        if (workload.hasCredentials()) {
            add(args, "--user", workload.user());
            if (workload.password() != null) {
                add(args, "--password", workload.password());
                passwordIndex = args.size() - 1;
            }
        }
        return new DriverArguments(args, passwordIndex);
    }

    /**
     * Exist always takes the first index under {@code -f}.
     */
    private static RangeFlag rangeFlag(Workload workload) {
        return workload.operation() == WorkloadOperation.EXIST ? RangeFlag.FIRST : workload.rangeFlag();
    }

    private static void add(List<String> args, String flag, String value) {
        if (value != null) {
            args.add(flag);
            args.add(value);
        }
    }

    public List<String> asList() {
        return arguments;
    }

    /**
     * Full command with the executable first.
     */
    public List<String> command(String executable) {
        List<String> command = new ArrayList<>(arguments.size() + 1);
        command.add(executable);
        command.addAll(arguments);
        return command;
    }

    /**
     * Arguments joined for logging, password masked.
     */
    public String toDisplayString() {
        List<String> shown = new ArrayList<>(arguments);
        if (passwordIndex >= 0) {
            shown.set(passwordIndex, MASK);
        }
        return String.join(" ", shown);
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
