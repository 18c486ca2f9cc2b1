package com.example.hubsyncservice.client.external;

/**
 * GraphQL documents sent to the Linear API.
 * Connection queries take {@code $first}/{@code $after} for cursor pagination and a typed
 * {@code $filter} built by {@link LinearClient}.
 */
final class LinearQueries {

    private LinearQueries() {
    }

    private static final String PAGE_INFO = "pageInfo { hasNextPage endCursor }";

    static final String TEAMS = """
            query Teams($first: Int!, $after: String, $filter: TeamFilter) {
              teams(first: $first, after: $after, filter: $filter) {
                %s
                nodes {
                  id
                  name
                  key
                  description
                  parent { id }
                  createdAt
                  updatedAt
                }
              }
            }
            """.formatted(PAGE_INFO);

    static final String INITIATIVES = """
            query Initiatives($first: Int!, $after: String, $filter: InitiativeFilter) {
              initiatives(first: $first, after: $after, filter: $filter) {
                %s
                nodes {
                  id
                  name
                  description
                  status
                  targetDate
                  projects { nodes { id } }
                  createdAt
                  updatedAt
                }
              }
            }
            """.formatted(PAGE_INFO);

    static final String TEAM_PROJECTS = """
            query TeamProjects($teamId: String!, $first: Int!, $after: String, $filter: ProjectFilter) {
              team(id: $teamId) {
                projects(first: $first, after: $after, filter: $filter) {
                  %s
                  nodes {
                    id
                    name
                    description
                    state
                    progress
                    startDate
                    targetDate
                    url
                    teams { nodes { id } }
                    createdAt
                    updatedAt
                  }
                }
              }
            }
            """.formatted(PAGE_INFO);

    static final String TEAM_CYCLES = """
            query TeamCycles($teamId: String!, $first: Int!, $after: String, $filter: CycleFilter) {
              team(id: $teamId) {
                cycles(first: $first, after: $after, filter: $filter) {
                  %s
                  nodes {
                    id
                    name
                    number
                    startsAt
                    endsAt
                    completedAt
                    progress
                    team { id }
                    createdAt
                    updatedAt
                  }
                }
              }
            }
            """.formatted(PAGE_INFO);

    static final String ISSUE_HISTORY = """
            query IssueHistory($issueId: String!, $first: Int!) {
              issue(id: $issueId) {
                history(first: $first) {
                  nodes {
                    id
                    createdAt
                    fromState { name color type }
                    toState { name color type }
                    fromPriority
                    toPriority
                    addedLabels { id name color }
                    removedLabels { id name color }
                  }
                }
              }
            }
            """;

    static final String PROJECT_UPDATES = """
            query ProjectUpdates($projectId: String!, $first: Int!) {
              project(id: $projectId) {
                id
                name
                projectUpdates(first: $first) {
                  nodes {
                    id
                    body
                    health
                    createdAt
                    updatedAt
                  }
                }
              }
            }
            """;

    static final String ISSUES = """
            query Issues($first: Int!, $after: String, $filter: IssueFilter) {
              issues(first: $first, after: $after, filter: $filter, orderBy: updatedAt) {
                %s
                nodes {
                  %s
                }
              }
            }
            """.formatted(PAGE_INFO, Fields.ISSUE);

    static final String COMMENTS = """
            query Comments($first: Int!, $after: String, $filter: CommentFilter) {
              comments(first: $first, after: $after, filter: $filter) {
                %s
                nodes {
                  id
                  body
                  user { name }
                  issue { id team { id } }
                  createdAt
                  updatedAt
                }
              }
            }
            """.formatted(PAGE_INFO);

    static final String COMMENT_CREATE = """
            mutation CommentCreate($issueId: String!, $body: String!) {
              commentCreate(input: { issueId: $issueId, body: $body }) {
                success
                comment {
                  id
                  body
                  user { name }
                  issue { id team { id } }
                  createdAt
                  updatedAt
                }
              }
            }
            """;

    static final String ISSUE_UPDATE_LABELS = """
            mutation IssueUpdateLabels($issueId: String!, $labelIds: [String!]!) {
              issueUpdate(id: $issueId, input: { labelIds: $labelIds }) {
                success
                issue {
                  %s
                }
              }
            }
            """.formatted(Fields.ISSUE);

    static final String ISSUE_CREATE = """
            mutation IssueCreate($input: IssueCreateInput!) {
              issueCreate(input: $input) {
                success
                issue {
                  %s
                }
              }
            }
            """.formatted(Fields.ISSUE);

    static final String WEBHOOK_CREATE = """
            mutation WebhookCreate($input: WebhookCreateInput!) {
              webhookCreate(input: $input) {
                success
                webhook { id enabled }
              }
            }
            """;

    static final String WEBHOOK_UPDATE = """
            mutation WebhookUpdate($id: String!, $input: WebhookUpdateInput!) {
              webhookUpdate(id: $id, input: $input) {
                success
                webhook { id enabled }
              }
            }
            """;

    static final String WEBHOOK_DELETE = """
            mutation WebhookDelete($id: String!) {
              webhookDelete(id: $id) {
                success
              }
            }
            """;

    private static final class Fields {
        static final String ISSUE = """
                id
                identifier
                title
                description
                priority
                url
                dueDate
                state { id name type }
                assignee { name }
                labels { nodes { id name color } }
                cycle { id name number }
                team { id }
                project { id }
                createdAt
                updatedAt""";
    }
}
