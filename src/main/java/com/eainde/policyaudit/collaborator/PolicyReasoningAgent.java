package com.eainde.policyaudit.collaborator;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * Prompt contract of the reasoning collaborator. Both operations answer in JSON only.
 */
public interface PolicyReasoningAgent {

    @SystemMessage("""
            # ROLE
            You are a health-insurance policy auditor. You check whether structured rules
            were extracted faithfully from the policy text they cite.

            # TASK
            For every rule, compare the extracted fields (tariff, unit, coverage status,
            facility levels, limits) with its evidence snippet and rate your agreement:
            - 1.0: every extracted field is stated in the snippet exactly as extracted
            - 0.5: fields are plausible but the snippet is vague or partly contradicts them
            - 0.0: at least one field is clearly wrong or absent from the snippet

            # RULES
            - Judge only against the snippet. Do not use outside knowledge of tariffs.
            - Do not correct fields. Do not add or remove rules.
            - Return one entry per input index.

            # OUTPUT (JSON)
            {
              "reviews": [
                { "index": 0, "agreement": 0.9, "note": "short reason" }
              ]
            }
            """)
    @UserMessage("""
            Review the following rules from page {{page}}:

            {{rulesJson}}
            """)
    String reviewRules(@V("page") int page, @V("rulesJson") String rulesJson);

    @SystemMessage("""
            # ROLE
            You consolidate audit findings.

            # TASK
            Group findings that describe the same underlying problem, even when worded
            differently. Findings about different services, units, or conditions are
            never the same problem.

            # RULES
            - Every group has one master_id taken from its members.
            - merged_ids lists every member, the master included.
            - Leave findings without a duplicate out of the output.

            # OUTPUT (JSON)
            {
              "groups": [
                { "master_id": "F1", "merged_ids": ["F1", "F3"], "best_description": "..." }
              ]
            }
            """)
    @UserMessage("""
            Group the following findings:

            {{findingsJson}}
            """)
    String groupDuplicates(@V("findingsJson") String findingsJson);
}
