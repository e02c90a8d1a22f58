package com.streamspy.collection.core.spi;

import java.util.Locale;

/**
 * Labels observables by class name: {@code IntervalObservable} becomes type {@code interval} and
 * path {@code /interval}. Tags come from {@link Tagged}.
 */
public class ClassNameInference implements ObservableInference {
    private static final String[] SUFFIXES = {"Observable", "Operator", "Publisher", "Flowable"};

    @Override
    public String inferPath(Object observable) {
        return "/" + inferType(observable);
    }

    @Override
    public String inferType(Object observable) {
        String name = observable.getClass().getSimpleName();
        if (name.isEmpty()) name = observable.getClass().getName();
        for (String suffix : SUFFIXES) {
            if (name.length() > suffix.length() && name.endsWith(suffix)) {
                name = name.substring(0, name.length() - suffix.length());
                break;
            }
        }
        return name.substring(0, 1).toLowerCase(Locale.ROOT) + name.substring(1);
    }

    @Override
    public String inferTag(Object observable) {
        if (observable instanceof Tagged tagged) return tagged.tag();
        return null;
    }
}
