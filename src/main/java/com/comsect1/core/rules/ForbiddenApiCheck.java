package com.comsect1.core.rules;

import com.comsect1.core.extract.ForbiddenApi;
import com.comsect1.core.model.Finding;
import com.comsect1.core.model.Reference;
import com.comsect1.core.model.ReferenceKind;
import com.comsect1.core.model.Role;
import com.comsect1.core.model.RoleAssignment;
import com.comsect1.core.model.SourceFile;

import java.util.ArrayList;
import java.util.List;

/**
 * Idea files must stay free of UI, I/O and platform APIs.
 */
public class ForbiddenApiCheck {

    public List<Finding> check(SourceFile file, RoleAssignment source, List<Reference> references) {
        if (source.role().layer() != Role.Layer.IDEA) {
            return List.of();
        }
        var findings = new ArrayList<Finding>();
        for (Reference ref : references) {
            if (ref.kind() != ReferenceKind.NAMESPACE_IMPORT && ref.kind() != ReferenceKind.API_CALL) {
                continue;
            }
            ForbiddenApi.byRuleId(ref.target()).ifPresent(api ->
                    findings.add(Finding.error(file.displayPath(), ref.line(), api.ruleId(),
                            "Forbidden in ida_: " + api.describe(file.extension()))));
        }
        return findings;
    }
}
