package com.vidnyan.archgate.adapter.out.syntax;

import com.vidnyan.archgate.domain.model.RestrictedCall;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Marks .NET API calls that belong to Interpretation or Production, never to Intent.
 * Shared by the C# and Visual Basic adapters; input lines must have comments and strings blanked.
 */
final class RestrictedCallScanner {

    private record RestrictedApi(Pattern pattern, String api, String reason) {}

    private static final List<RestrictedApi> APIS = List.of(
            new RestrictedApi(Pattern.compile("\\bMessageBox\\.Show\\s*\\("), "MessageBox.Show",
                    "UI feedback must stay in Interpretation or Production"),
            new RestrictedApi(Pattern.compile("\\.(?:Begin)?Invoke\\s*\\("), ".Invoke/.BeginInvoke",
                    "UI thread marshalling"),
            new RestrictedApi(Pattern.compile("\\bThread\\.Sleep\\s*\\("), "Thread.Sleep",
                    "blocking delay, use a timing abstraction"),
            new RestrictedApi(Pattern.compile("\\bProcess\\.Start\\s*\\("), "Process.Start",
                    "OS shell call"));

    private RestrictedCallScanner() {
    }

    static List<RestrictedCall> scan(List<String> codeLines) {
        List<RestrictedCall> calls = new ArrayList<>();
        for (int i = 0; i < codeLines.size(); i++) {
            for (RestrictedApi api : APIS) {
                Matcher matcher = api.pattern().matcher(codeLines.get(i));
                if (matcher.find()) {
                    calls.add(new RestrictedCall(api.api(), api.reason(), i + 1));
                }
            }
        }
        return calls;
    }
}
