/* 
 * Copyright (C) 2025 Scopie developers
 *
 * This File is part of Scopie
 *
 * Scopie is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * Scopie is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with Scopie.  If not, see <http://www.gnu.org/licenses/>.
 */
package scopie.utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.BiPredicate;
import java.util.stream.Collectors;

/**
 * Groups exceptions raised by several independent callees. Each exception is localized by a string (e.g. the subscriber or item that raised it).
 */
public class MultipleException extends RuntimeException {
    final private List<Pair<String, Throwable>> exceptions;
    public MultipleException(List<Pair<String, Throwable>> exceptions) {
        this.exceptions= new ArrayList<>();
        addExceptions(exceptions);
    }
    public MultipleException() {
        this.exceptions=new ArrayList<>();
    }
    @SafeVarargs
    public final void addExceptions(Pair<String, Throwable>... ex) {
        if (ex==null || ex.length==0) return;
        addExceptions(Arrays.asList(ex));
    }
    public void addExceptions(Collection<Pair<String, Throwable>> ex) {
        ex.forEach(this::addException);
    }

    private void addException(Pair<String, Throwable> ex) {
        if (ex==null || ex.value==null || ex.key==null) return;
        for (Pair<String, Throwable> p : exceptions) {
            if (throwableEqual.test(p.value, ex.value)) {
                p.key+=";"+ex.key;
                return;
            }
        }
        exceptions.add(ex);
        addSuppressed(ex.value);
    }

    /**
     * Same exception raised at several places: same message, stack trace and cause
     */
    public final static BiPredicate<Throwable, Throwable> throwableEqual = (t1, t2) -> sameOrigin(t1, t2) && sameOrigin(t1.getCause(), t2.getCause());

    private static boolean sameOrigin(Throwable t1, Throwable t2) {
        if (t1==null || t2==null) return t1==t2;
        return Objects.equals(t1.getMessage(), t2.getMessage()) && Arrays.equals(t1.getStackTrace(), t2.getStackTrace());
    }

    public List<Pair<String, Throwable>> getExceptions() {
        return exceptions;
    }
    public boolean isEmpty() {
        return exceptions.isEmpty();
    }

    @Override
    public String getMessage() {
        return exceptions.size()+" error(s): "+exceptions.stream().map(p -> p.key+": "+p.value).collect(Collectors.joining(", "));
    }
}
